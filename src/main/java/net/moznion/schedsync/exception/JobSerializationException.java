package net.moznion.schedsync.exception;

/**
 * Raised when a scheduler entry member cannot be written as JSON text.
 */
public class JobSerializationException extends RuntimeException {
    private static final long serialVersionUID = -2280561493471985523L;

    public JobSerializationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
