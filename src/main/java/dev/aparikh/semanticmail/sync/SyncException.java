package dev.aparikh.semanticmail.sync;

import dev.aparikh.semanticmail.error.ErrorKind;
import dev.aparikh.semanticmail.error.PipelineException;

/**
 * A sync run ended without a summary. The cursor has not moved.
 */
public class SyncException extends PipelineException {

    public enum Reason {
        /** Mailbox credentials were rejected; the user has to re-authenticate. */
        AUTH_EXPIRED,
        STORE_UNAVAILABLE,
        MAILBOX_UNAVAILABLE,
        EMBEDDING_UNAVAILABLE,
        /** Another run for the same user is in progress. */
        ALREADY_RUNNING,
        CANCELLED
    }

    private final Reason reason;

    public SyncException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public SyncException(Reason reason, String message) {
        this(reason, message, null);
    }

    public Reason reason() {
        return reason;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.FATAL;
    }
}
