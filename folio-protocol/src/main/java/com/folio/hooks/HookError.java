package com.folio.hooks;

/**
 * Non-fatal problem recorded in the context's {@code errors} slot (e.g. a hook that threw, or a patch
 * touching a slot the hook point does not allow).
 *
 * @param hookPoint hook point that was running
 * @param hookName  name of the offending hook
 * @param message   description
 */
public record HookError(String hookPoint, String hookName, String message) {

    public HookError {
        hookPoint = hookPoint != null ? hookPoint : "";
        hookName = hookName != null ? hookName : "";
        message = message != null ? message : "";
    }
}
