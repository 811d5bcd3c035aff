package dev.fumaz.instill.exception;

/**
 * Indicates an invalid injection declaration detected while reading a type's injection points.
 */
public class ConfigurationException extends InstillException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

    public ConfigurationException(Throwable cause) {
        super(cause);
    }
}
