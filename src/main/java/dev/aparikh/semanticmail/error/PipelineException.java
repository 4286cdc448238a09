package dev.aparikh.semanticmail.error;

/**
 * Base class for failures raised by pipeline components. Callers branch on {@link #kind()}
 * rather than on the message text.
 */
public abstract class PipelineException extends RuntimeException {

    protected PipelineException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorKind kind();

    public boolean isTransient() {
        return kind() == ErrorKind.TRANSIENT;
    }
}
