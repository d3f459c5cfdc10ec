package com.pressroom.api.hook;

import com.pressroom.core.exception.HookException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Runs the registered {@link AfterCreateHook}s for a freshly committed entity.
 * 
 * Must be called after the creating transaction has committed, never from inside it:
 * hooks observe committed state and a hook failure cannot roll anything back.
 */
@Component
public class LifecycleHookDispatcher {

    private static final Logger log = LoggerFactory.getLogger(LifecycleHookDispatcher.class);

    private final List<AfterCreateHook<?>> hooks;

    public LifecycleHookDispatcher(List<AfterCreateHook<?>> hooks) {
        this.hooks = List.copyOf(hooks);
    }

    /**
     * Invokes every hook registered for the entity's type, synchronously and exactly once.
     *
     * @return number of hooks that completed without error
     */
    public int afterCreate(Object entity) {
        int completed = 0;
        for (AfterCreateHook<?> hook : hooks) {
            if (hook.entityType().isInstance(entity) && invoke(hook, entity)) {
                completed++;
            }
        }
        return completed;
    }

    private <T> boolean invoke(AfterCreateHook<T> hook, Object entity) {
        try {
            hook.afterCreate(hook.entityType().cast(entity));
            return true;
        } catch (RuntimeException e) {
            HookException failure = new HookException(hook.name(), entity, e);
            log.warn(failure.getMessage(), failure);
            return false;
        }
    }
}
