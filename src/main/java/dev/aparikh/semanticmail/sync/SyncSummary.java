package dev.aparikh.semanticmail.sync;

import dev.aparikh.semanticmail.model.FilterReason;
import dev.aparikh.semanticmail.model.RunStatus;

import java.time.Instant;
import java.util.Map;

/**
 * Outcome of one sync run.
 *
 * @param processed messages persisted in this run, filtered ones included
 * @param filtered  persisted messages marked as filtered
 * @param vectorized rows that received an embedding, retried pending rows included
 * @param failed    rows left without an embedding
 * @param skipped   messages dropped as duplicates
 * @param cursor    {@code lastSyncedAt} after the run
 */
public record SyncSummary(
        String userId,
        Instant fromDate,
        int processed,
        int filtered,
        int vectorized,
        int failed,
        int skipped,
        RunStatus status,
        Instant cursor,
        Map<FilterReason, Integer> filterReasons
) {
    public SyncSummary {
        filterReasons = filterReasons == null ? Map.of() : Map.copyOf(filterReasons);
    }

    public int emailsProcessed() {
        return processed;
    }
}
