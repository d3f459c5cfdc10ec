package com.pressroom.core.exception;

/**
 * Failure inside a lifecycle hook. Logged by the dispatcher, never handed to the
 * caller of the write that triggered the hook.
 */
public class HookException extends PressroomException {

    private final String hookName;

    public HookException(String hookName, Object entity, Throwable cause) {
        super("Hook " + hookName + " failed for " + entity, cause);
        this.hookName = hookName;
    }

    public String getHookName() {
        return hookName;
    }
}
