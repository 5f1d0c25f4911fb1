package io.github.drompincen.polarionclient.runtime.retry;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * @param maxRetries retries after the first attempt; an operation runs at most {@code maxRetries + 1} times
 * @param retryIf    decides whether a failure is transient
 */
public record RetryPolicy(
        int maxRetries,
        Duration minWait,
        Duration maxWait,
        Predicate<Throwable> retryIf
) {
    public static final int DEFAULT_MAX_RETRIES = 1;
    public static final Duration DEFAULT_MIN_WAIT = Duration.ofSeconds(5);
    public static final Duration DEFAULT_MAX_WAIT = Duration.ofSeconds(15);

    public RetryPolicy {
        Objects.requireNonNull(minWait, "minWait");
        Objects.requireNonNull(maxWait, "maxWait");
        Objects.requireNonNull(retryIf, "retryIf");
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, got " + maxRetries);
        }
        if (minWait.isNegative() || maxWait.compareTo(minWait) < 0) {
            throw new IllegalArgumentException("Require 0 <= minWait <= maxWait, got " + minWait + " / " + maxWait);
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_MAX_RETRIES, DEFAULT_MIN_WAIT, DEFAULT_MAX_WAIT, Retryability::isRetryable);
    }

    public static RetryPolicy none() {
        return new RetryPolicy(0, Duration.ZERO, Duration.ZERO, Retryability::isRetryable);
    }

    public RetryPolicy withMaxRetries(int retries) {
        return new RetryPolicy(retries, minWait, maxWait, retryIf);
    }

    public RetryPolicy withWaits(Duration min, Duration max) {
        return new RetryPolicy(maxRetries, min, max, retryIf);
    }

    public RetryPolicy withRetryIf(Predicate<Throwable> predicate) {
        return new RetryPolicy(maxRetries, minWait, maxWait, predicate);
    }
}
