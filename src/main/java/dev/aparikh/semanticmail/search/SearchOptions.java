package dev.aparikh.semanticmail.search;

import java.util.Optional;

/**
 * Similarity search criteria.
 * {@code limit} caps the number of hits, {@code threshold} is the minimum cosine similarity,
 * and the optional {@code userId} restricts the search to one user's rows.
 */
public record SearchOptions(
        int limit,
        double threshold,
        String userId
) {
    public static final int DEFAULT_LIMIT = 10;
    public static final double DEFAULT_THRESHOLD = 0.7;

    public SearchOptions {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0");
        }
        if (threshold < -1 || threshold > 1) {
            throw new IllegalArgumentException("threshold must be within [-1, 1]");
        }
    }

    public Optional<String> userIdOpt() {
        return Optional.ofNullable(userId).filter(s -> !s.isBlank());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int limit = DEFAULT_LIMIT;
        private double threshold = DEFAULT_THRESHOLD;
        private String userId;

        public Builder limit(int limit) {
            this.limit = limit;
            return this;
        }

        public Builder threshold(double threshold) {
            this.threshold = threshold;
            return this;
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public SearchOptions build() {
            return new SearchOptions(limit, threshold, userId);
        }
    }
}
