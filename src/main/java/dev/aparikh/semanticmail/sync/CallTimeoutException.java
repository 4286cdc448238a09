package dev.aparikh.semanticmail.sync;

import dev.aparikh.semanticmail.error.ErrorKind;
import dev.aparikh.semanticmail.error.PipelineException;

import java.time.Duration;

/**
 * An external call did not answer within the configured timeout.
 */
public class CallTimeoutException extends PipelineException {

    public CallTimeoutException(String what, Duration timeout) {
        super(what + " timed out after " + timeout, null);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.TRANSIENT;
    }
}
