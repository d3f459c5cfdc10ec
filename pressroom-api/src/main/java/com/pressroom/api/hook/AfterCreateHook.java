package com.pressroom.api.hook;

/**
 * Side effect run once after an entity of type {@code T} has been inserted and committed.
 * 
 * Implementations are Spring beans and are picked up by {@link LifecycleHookDispatcher}.
 * A hook may fail; its failure is logged and never reaches the caller of the create.
 */
public interface AfterCreateHook<T> {

    Class<T> entityType();

    void afterCreate(T entity);

    default String name() {
        return getClass().getSimpleName();
    }
}
