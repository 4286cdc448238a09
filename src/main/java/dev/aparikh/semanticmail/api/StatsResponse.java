package dev.aparikh.semanticmail.api;

import dev.aparikh.semanticmail.indexing.VectorStats;
import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Response DTO for vectorization counts of one user.
 */
@Schema(description = "Vectorization statistics")
public record StatsResponse(
        @Schema(description = "Non-filtered emails", example = "250")
        long total,

        @Schema(description = "Emails with an embedding", example = "240")
        long vectorized,

        @Schema(description = "Emails still waiting for an embedding", example = "10")
        long pending
) {
    public static StatsResponse from(VectorStats stats) {
        return new StatsResponse(stats.total(), stats.vectorized(), stats.pending());
    }
}
