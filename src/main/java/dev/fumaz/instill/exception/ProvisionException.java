package dev.fumaz.instill.exception;

import org.jetbrains.annotations.Nullable;

/**
 * Signals that a constructor, method or member write failed for a reason unrelated to resolution.
 * The original failure is always kept as the cause.
 */
public class ProvisionException extends ResolutionException {

    public ProvisionException(@Nullable Class<?> targetType, String message, Throwable cause) {
        super(targetType, null, message, cause);
    }
}
