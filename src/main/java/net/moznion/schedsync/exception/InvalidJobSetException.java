package net.moznion.schedsync.exception;

import java.nio.file.Path;

import lombok.Getter;

/**
 * Job or user configuration that cannot be expanded, e.g. two jobs sharing a name.
 */
public class InvalidJobSetException extends Exception {
    private static final long serialVersionUID = 1460962347731562298L;

    @Getter
    private final Path source;

    public InvalidJobSetException(final String message, final Path source) {
        super(message + " [source=" + source + ']');
        this.source = source;
    }

    public InvalidJobSetException(final String message, final Path source, final Throwable cause) {
        super(message + " [source=" + source + ']', cause);
        this.source = source;
    }
}
