package dev.aparikh.semanticmail.sync;

/**
 * Stage of a user's sync run. {@code FAILED} is kept until the next run starts.
 */
public enum SyncState {
    IDLE,
    FETCHING,
    CLASSIFYING,
    CHUNKING,
    EMBEDDING,
    PERSISTING,
    CURSOR_COMMIT,
    FAILED
}
