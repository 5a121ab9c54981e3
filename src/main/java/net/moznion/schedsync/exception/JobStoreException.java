package net.moznion.schedsync.exception;

import lombok.Getter;

public class JobStoreException extends RuntimeException {
    private static final long serialVersionUID = 6619508830214772095L;

    @Getter
    private final String entryId;

    public JobStoreException(final String message, final Throwable cause) {
        super(message, cause);
        entryId = null;
    }

    public JobStoreException(final String message, final String entryId, final Throwable cause) {
        super(message + " [entryId=" + entryId + ']', cause);
        this.entryId = entryId;
    }
}
