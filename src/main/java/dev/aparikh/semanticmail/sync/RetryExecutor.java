package dev.aparikh.semanticmail.sync;

import dev.aparikh.semanticmail.error.PipelineException;
import dev.aparikh.semanticmail.ratelimit.RateGovernor;
import dev.aparikh.semanticmail.ratelimit.RateLimit;
import dev.aparikh.semanticmail.ratelimit.RateLimitedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs calls to external dependencies with a timeout, a rate budget and bounded retries.
 *
 * <p>Only {@link PipelineException}s of kind {@code TRANSIENT} are retried, with exponential
 * backoff capped at {@code maxBackoff}. A rejection by the {@link RateGovernor} waits at least
 * until its window resets. When attempts run out the last failure is rethrown unchanged.
 * An interrupt while waiting ends the call with {@link SyncException.Reason#CANCELLED}.</p>
 */
public class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    // dependency keys
    public static final String MAILBOX = "mailbox";
    public static final String EMBEDDING = "embedding";
    public static final String STORE = "store";

    /** Waits between attempts; swapped out in tests. */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final RateGovernor governor;
    private final Map<String, RateLimit> limits;
    private final MdcTaskExecutor callExecutor;
    private final Clock clock;
    private final Duration callTimeout;
    private final int maxAttempts;
    private final Duration initialBackoff;
    private final Duration maxBackoff;
    private final Sleeper sleeper;

    public RetryExecutor(RateGovernor governor, Map<String, RateLimit> limits, MdcTaskExecutor callExecutor,
                         Clock clock, Duration callTimeout, int maxAttempts,
                         Duration initialBackoff, Duration maxBackoff, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        this.governor = governor;
        this.limits = Map.copyOf(limits);
        this.callExecutor = callExecutor;
        this.clock = clock;
        this.callTimeout = callTimeout;
        this.maxAttempts = maxAttempts;
        this.initialBackoff = initialBackoff;
        this.maxBackoff = maxBackoff;
        this.sleeper = sleeper;
    }

    /**
     * Calls {@code call} against the dependency named {@code dependencyKey}.
     *
     * @param what short description used in log lines and timeout messages
     */
    public <T> T call(String dependencyKey, String what, Supplier<T> call) {
        RateLimit limit = limits.get(dependencyKey);
        for (int attempt = 1; ; attempt++) {
            try {
                if (limit != null) {
                    governor.acquireOrThrow(dependencyKey, limit);
                }
                return callWithTimeout(what, call);
            } catch (PipelineException e) {
                if (!e.isTransient() || attempt >= maxAttempts) {
                    throw e;
                }
                Duration wait = backoff(attempt, e);
                log.warn("Attempt {}/{} to {} failed ({}), retrying in {} ms",
                        attempt, maxAttempts, what, e.getMessage(), wait.toMillis());
                pause(wait, what);
            }
        }
    }

    Duration backoff(int attempt, PipelineException failure) {
        long factor = 1L << Math.min(attempt - 1, 20);
        Duration wait = initialBackoff.multipliedBy(factor);
        if (wait.compareTo(maxBackoff) > 0) {
            wait = maxBackoff;
        }
        if (failure instanceof RateLimitedException limited) {
            Duration untilReset = Duration.between(clock.instant(), limited.resetAt());
            if (untilReset.compareTo(wait) > 0) {
                wait = untilReset;
            }
        }
        return wait;
    }

    private <T> T callWithTimeout(String what, Supplier<T> call) {
        Future<T> future = callExecutor.submit(call::get);
        try {
            return future.get(callTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new CallTimeoutException(what, callTimeout);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new SyncException(SyncException.Reason.CANCELLED, "Interrupted during " + what, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Unexpected failure during " + what, cause);
        }
    }

    private void pause(Duration wait, String what) {
        try {
            sleeper.sleep(wait);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SyncException(SyncException.Reason.CANCELLED, "Interrupted while waiting to retry " + what, e);
        }
    }
}
