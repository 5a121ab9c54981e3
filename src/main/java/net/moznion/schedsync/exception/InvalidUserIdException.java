package net.moznion.schedsync.exception;

public class InvalidUserIdException extends IllegalArgumentException {
    private static final long serialVersionUID = 3871046257129436810L;

    public InvalidUserIdException(final String message) {
        super(message);
    }
}
