package dev.aparikh.semanticmail.ratelimit;

import java.time.Instant;

public record RateDecision(
        boolean allowed,
        int remaining,
        Instant resetAt
) {
}
