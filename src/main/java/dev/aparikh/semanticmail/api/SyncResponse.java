package dev.aparikh.semanticmail.api;

import dev.aparikh.semanticmail.model.RunStatus;
import dev.aparikh.semanticmail.sync.SyncSummary;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;

/**
 * Response DTO summarising a completed sync run.
 */
@Schema(description = "Sync run summary")
public record SyncResponse(
        @Schema(description = "Messages persisted in this run", example = "120")
        int emailsProcessed,

        @Schema(description = "Lower bound of the synced window", example = "2025-01-01T00:00:00Z")
        Instant fromDate,

        @Schema(description = "Messages persisted in this run, filtered ones included", example = "120")
        int processed,

        @Schema(description = "Persisted messages marked as filtered", example = "35")
        int filtered,

        @Schema(description = "Rows that received an embedding", example = "84")
        int vectorized,

        @Schema(description = "Rows left without an embedding", example = "1")
        int failed,

        @Schema(description = "Duplicates skipped", example = "12")
        int skipped,

        @Schema(description = "Run status", example = "PARTIAL")
        RunStatus status
) {
    public static SyncResponse from(SyncSummary summary) {
        return new SyncResponse(summary.emailsProcessed(), summary.fromDate(), summary.processed(),
                summary.filtered(), summary.vectorized(), summary.failed(), summary.skipped(), summary.status());
    }
}
