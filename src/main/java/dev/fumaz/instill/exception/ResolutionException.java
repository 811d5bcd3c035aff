package dev.fumaz.instill.exception;

import org.jetbrains.annotations.Nullable;

/**
 * Signals that a dependency could not be resolved or an injection point could not be satisfied.
 */
public class ResolutionException extends InstillException {

    private final @Nullable Class<?> serviceType;
    private final @Nullable String key;

    public ResolutionException(String message) {
        this(null, null, message, null);
    }

    public ResolutionException(String message, Throwable cause) {
        this(null, null, message, cause);
    }

    public ResolutionException(@Nullable Class<?> serviceType, String message) {
        this(serviceType, null, message, null);
    }

    public ResolutionException(@Nullable Class<?> serviceType, @Nullable String key, String message,
                               @Nullable Throwable cause) {
        super(message, cause);
        this.serviceType = serviceType;
        this.key = key;
    }

    public static ResolutionException cannotInstantiateAbstract(Class<?> type) {
        return new ResolutionException(type, "Cannot instantiate abstract type or interface " + type.getName());
    }

    public static ResolutionException noSuitableConstructor(Class<?> type) {
        return new ResolutionException(type, "No suitable constructor found for " + type.getName());
    }

    public @Nullable Class<?> getServiceType() {
        return serviceType;
    }

    public @Nullable String getKey() {
        return key;
    }

    protected static String describe(@Nullable Class<?> type, @Nullable String key) {
        String name = type == null ? "null" : type.getName();

        if (key == null) {
            return name;
        }

        return name + " (key '" + key + "')";
    }
}
