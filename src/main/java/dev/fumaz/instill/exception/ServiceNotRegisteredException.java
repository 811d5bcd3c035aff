package dev.fumaz.instill.exception;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Thrown when neither an ordinary nor a keyed lookup finds a registration for a required dependency.
 */
public class ServiceNotRegisteredException extends ResolutionException {

    public ServiceNotRegisteredException(@NotNull Class<?> serviceType) {
        this(serviceType, null);
    }

    public ServiceNotRegisteredException(@NotNull Class<?> serviceType, @Nullable String key) {
        super(serviceType, key, "Unable to resolve " + describe(serviceType, key)
                + ", no matching registration found", null);
    }
}
