package dev.aparikh.semanticmail.embedding;

import dev.aparikh.semanticmail.error.ErrorKind;
import dev.aparikh.semanticmail.error.PipelineException;

public class EmbeddingException extends PipelineException {

    public enum Reason {
        /** API key rejected; nothing will succeed until configuration changes. */
        AUTH(ErrorKind.FATAL),
        RATE_LIMITED(ErrorKind.TRANSIENT),
        /** Timeout, network failure or provider 5xx. */
        UNAVAILABLE(ErrorKind.TRANSIENT),
        /** The provider refused this particular input. */
        REJECTED(ErrorKind.PERMANENT);

        private final ErrorKind kind;

        Reason(ErrorKind kind) {
            this.kind = kind;
        }
    }

    private final Reason reason;

    public EmbeddingException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public EmbeddingException(Reason reason, String message) {
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
