package dev.aparikh.semanticmail.error;

/**
 * How a failure should be treated by the caller.
 */
public enum ErrorKind {
    /** Worth retrying with backoff. */
    TRANSIENT,
    /** Retrying will not help; the affected item is recorded as failed. */
    PERMANENT,
    /** The whole run must stop. */
    FATAL
}
