package dev.aparikh.semanticmail.model;

import java.time.Instant;

/**
 * Per-user boundary between synced and not yet synced messages.
 * {@code lastSyncedAt} is {@code null} before the first successful batch.
 */
public record SyncCursor(
        String userId,
        Instant lastSyncedAt,
        RunStatus lastRunStatus,
        Instant updatedAt
) {
    // Solr field names for the cursor core
    public static final String FIELD_ID = "id";
    public static final String FIELD_LAST_SYNCED_AT = "last_synced_at";
    public static final String FIELD_LAST_RUN_STATUS = "last_run_status";
    public static final String FIELD_UPDATED_AT = "updated_at";

    public SyncCursor {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must be provided");
        }
    }

    /**
     * Returns a cursor moved to {@code candidate}, never moving backwards.
     */
    public SyncCursor advanceTo(Instant candidate, RunStatus status, Instant now) {
        Instant next = lastSyncedAt;
        if (candidate != null && (next == null || candidate.isAfter(next))) {
            next = candidate;
        }
        return new SyncCursor(userId, next, status, now);
    }

    public SyncCursor withStatus(RunStatus status, Instant now) {
        return new SyncCursor(userId, lastSyncedAt, status, now);
    }
}
