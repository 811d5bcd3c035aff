package dev.fumaz.instill.reflection;

import dev.fumaz.instill.exception.ConfigurationException;

public class ReflectionException extends ConfigurationException {

    public ReflectionException(String message) {
        super(message);
    }

    public ReflectionException(String message, Throwable cause) {
        super(message, cause);
    }

}
