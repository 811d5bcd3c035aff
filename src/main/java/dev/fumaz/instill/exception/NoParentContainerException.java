package dev.fumaz.instill.exception;

import org.jetbrains.annotations.NotNull;

/**
 * Thrown when a dependency must come from the parent resolver but the current resolver has none.
 */
public class NoParentContainerException extends ResolutionException {

    public NoParentContainerException(@NotNull Class<?> serviceType) {
        super(serviceType, "Attempted to resolve " + serviceType.getName()
                + " from the parent resolver, but no parent exists");
    }
}
