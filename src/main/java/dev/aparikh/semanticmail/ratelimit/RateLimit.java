package dev.aparikh.semanticmail.ratelimit;

import java.time.Duration;

/**
 * Budget of {@code maxCalls} per fixed {@code window} for one external dependency.
 */
public record RateLimit(
        Duration window,
        int maxCalls
) {
    public RateLimit {
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive");
        }
        if (maxCalls < 1) {
            throw new IllegalArgumentException("maxCalls must be >= 1");
        }
    }
}
