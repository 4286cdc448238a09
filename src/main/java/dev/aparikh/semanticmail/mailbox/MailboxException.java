package dev.aparikh.semanticmail.mailbox;

import dev.aparikh.semanticmail.error.ErrorKind;
import dev.aparikh.semanticmail.error.PipelineException;

public class MailboxException extends PipelineException {

    public enum Reason {
        /** Credentials rejected; the user has to re-authenticate. */
        AUTH_EXPIRED(ErrorKind.FATAL),
        /** Network failure, timeout or provider 5xx. */
        UNAVAILABLE(ErrorKind.TRANSIENT),
        /** Provider quota hit. */
        RATE_LIMITED(ErrorKind.TRANSIENT),
        /** Request or response the provider or this client cannot make sense of. */
        MALFORMED(ErrorKind.PERMANENT);

        private final ErrorKind kind;

        Reason(ErrorKind kind) {
            this.kind = kind;
        }
    }

    private final Reason reason;

    public MailboxException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public MailboxException(Reason reason, String message) {
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
