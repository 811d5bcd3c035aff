package dev.fumaz.instill.exception;

/**
 * Base unchecked exception for Instill-specific failures.
 */
public class InstillException extends RuntimeException {

    public InstillException(String message) {
        super(message);
    }

    public InstillException(String message, Throwable cause) {
        super(message, cause);
    }

    public InstillException(Throwable cause) {
        super(cause);
    }
}
