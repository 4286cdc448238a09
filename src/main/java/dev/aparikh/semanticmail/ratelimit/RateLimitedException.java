package dev.aparikh.semanticmail.ratelimit;

import dev.aparikh.semanticmail.error.ErrorKind;
import dev.aparikh.semanticmail.error.PipelineException;

import java.time.Instant;

/**
 * Raised when a call is rejected by the {@link RateGovernor}. The caller is expected to
 * retry no earlier than {@link #resetAt()}.
 */
public class RateLimitedException extends PipelineException {

    private final String dependencyKey;
    private final Instant resetAt;

    public RateLimitedException(String dependencyKey, Instant resetAt) {
        super("Rate limit reached for " + dependencyKey + ", window resets at " + resetAt, null);
        this.dependencyKey = dependencyKey;
        this.resetAt = resetAt;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.TRANSIENT;
    }

    public String dependencyKey() {
        return dependencyKey;
    }

    public Instant resetAt() {
        return resetAt;
    }
}
