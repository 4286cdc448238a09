package dev.aparikh.semanticmail.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fixed-window call counter keyed by dependency name.
 *
 * <p>One instance is shared by everything that talks to the same external dependency; it
 * keeps no state across restarts. A call either takes a slot or is rejected, and rejected
 * calls are the caller's to retry.</p>
 *
 * <p>Thread-safe.</p>
 */
public class RateGovernor {

    private static final Logger log = LoggerFactory.getLogger(RateGovernor.class);

    private final Clock clock;
    private final Map<String, RateWindow> windows = new ConcurrentHashMap<>();

    public RateGovernor(Clock clock) {
        this.clock = clock;
    }

    public RateDecision tryAcquire(String dependencyKey, long windowMs, int maxCalls) {
        if (windowMs < 1) {
            throw new IllegalArgumentException("windowMs must be >= 1");
        }
        if (maxCalls < 1) {
            throw new IllegalArgumentException("maxCalls must be >= 1");
        }
        long now = clock.millis();
        RateDecision[] decision = new RateDecision[1];
        windows.compute(dependencyKey, (key, current) -> {
            RateWindow window = current;
            if (window == null || now >= window.windowStart() + windowMs) {
                window = new RateWindow(0, now);
            }
            Instant resetAt = Instant.ofEpochMilli(window.windowStart() + windowMs);
            if (window.count() >= maxCalls) {
                decision[0] = new RateDecision(false, 0, resetAt);
                return window;
            }
            RateWindow next = new RateWindow(window.count() + 1, window.windowStart());
            decision[0] = new RateDecision(true, maxCalls - next.count(), resetAt);
            return next;
        });
        return decision[0];
    }

    public RateDecision tryAcquire(String dependencyKey, RateLimit limit) {
        return tryAcquire(dependencyKey, limit.window().toMillis(), limit.maxCalls());
    }

    /**
     * Takes a slot or throws {@link RateLimitedException}.
     */
    public void acquireOrThrow(String dependencyKey, RateLimit limit) {
        RateDecision decision = tryAcquire(dependencyKey, limit);
        if (!decision.allowed()) {
            log.debug("Rate limit reached for {}, resets at {}", dependencyKey, decision.resetAt());
            throw new RateLimitedException(dependencyKey, decision.resetAt());
        }
    }

    private record RateWindow(int count, long windowStart) {
    }
}
