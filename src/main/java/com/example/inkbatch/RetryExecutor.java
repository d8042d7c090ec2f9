package com.example.inkbatch;

import com.example.inkbatch.error.ErrorKind;
import com.example.inkbatch.error.PermanentFailureException;
import com.example.inkbatch.error.RetryExhaustedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.function.Predicate;

/**
 * Runs a fallible operation with a bounded number of attempts and exponential backoff.
 * Only errors accepted by the retryable predicate are retried; anything else fails fast.
 */
public final class RetryExecutor {
    private static final Logger LOGGER = LoggerFactory.getLogger(RetryExecutor.class);

    private final int maxRetries;
    private final Duration baseDelay;
    private final double backoffFactor;
    private final Predicate<Throwable> retryable;
    private final Sleeper sleeper;

    public RetryExecutor(int maxRetries, Duration baseDelay, double backoffFactor) {
        this(maxRetries, baseDelay, backoffFactor, ErrorKind::isRetryable, Sleeper.THREAD);
    }

    public RetryExecutor(int maxRetries,
                         Duration baseDelay,
                         double backoffFactor,
                         Predicate<Throwable> retryable,
                         Sleeper sleeper) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be non-negative");
        }
        if (baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must be non-negative");
        }
        if (backoffFactor < 1.0) {
            throw new IllegalArgumentException("backoffFactor must be at least 1.0");
        }
        this.maxRetries = maxRetries;
        this.baseDelay = baseDelay;
        this.backoffFactor = backoffFactor;
        this.retryable = retryable;
        this.sleeper = sleeper;
    }

    public <T> RetryResult<T> run(Attempt<T> operation)
            throws RetryExhaustedException, PermanentFailureException, InterruptedException {
        return run(operation, RetryListener.NONE);
    }

    public <T> RetryResult<T> run(Attempt<T> operation, RetryListener listener)
            throws RetryExhaustedException, PermanentFailureException, InterruptedException {
        int maxAttempts = maxRetries + 1;
        for (int attempt = 1; ; attempt++) {
            try {
                return new RetryResult<>(operation.call(), attempt);
            } catch (InterruptedException ex) {
                throw ex;
            } catch (Exception ex) {
                if (!retryable.test(ex)) {
                    throw new PermanentFailureException(ex, attempt);
                }
                if (attempt >= maxAttempts) {
                    throw new RetryExhaustedException(ex, attempt);
                }
                Duration delay = delayAfter(attempt - 1);
                LOGGER.debug("Attempt {}/{} failed ({}); retrying in {} ms",
                        attempt, maxAttempts, ex.getMessage(), delay.toMillis());
                listener.onRetry(new RetryAttempt(attempt, Instant.now(), ex, delay));
                sleeper.sleep(delay);
            }
        }
    }

    /**
     * Wait inserted after the failed attempt with zero-based index {@code k}: {@code baseDelay * backoffFactor^k}.
     */
    public Duration delayAfter(int k) {
        double nanos = baseDelay.toNanos() * Math.pow(backoffFactor, k);
        return Duration.ofNanos(Math.round(nanos));
    }

    public int maxRetries() {
        return maxRetries;
    }

    @FunctionalInterface
    public interface Attempt<T> {
        T call() throws Exception;
    }
}
