package dev.aparikh.semanticmail.indexing;

import dev.aparikh.semanticmail.error.ErrorKind;
import dev.aparikh.semanticmail.error.PipelineException;

public class StoreException extends PipelineException {

    public enum Reason {
        /** Backend unreachable or returning server errors. */
        UNAVAILABLE(ErrorKind.TRANSIENT),
        /** Backend refused the request, e.g. a schema mismatch. */
        REJECTED(ErrorKind.PERMANENT),
        NOT_FOUND(ErrorKind.PERMANENT),
        SERIALIZATION(ErrorKind.PERMANENT);

        private final ErrorKind kind;

        Reason(ErrorKind kind) {
            this.kind = kind;
        }
    }

    private final Reason reason;

    public StoreException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public StoreException(Reason reason, String message) {
        this(reason, message, null);
    }

    public Reason reason() {
        return reason;
    }

    @Override
    public ErrorKind kind() {
        return reason.kind;
    }
}
