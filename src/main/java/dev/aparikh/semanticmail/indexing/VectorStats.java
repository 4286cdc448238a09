package dev.aparikh.semanticmail.indexing;

/**
 * Vectorization progress over a user's non-filtered rows.
 */
public record VectorStats(
        long total,
        long vectorized,
        long pending
) {
}
