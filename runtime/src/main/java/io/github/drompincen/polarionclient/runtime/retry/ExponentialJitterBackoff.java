package io.github.drompincen.polarionclient.runtime.retry;

import java.time.Duration;
import java.util.Random;

/**
 * {@code minWait * 2^attempt}, capped at {@code maxWait}, then shifted by up to 25% either way
 * and clamped back into {@code [minWait, maxWait]}.
 */
public final class ExponentialJitterBackoff implements BackoffStrategy {

    private final Random random;

    public ExponentialJitterBackoff() {
        this(new Random());
    }

    public ExponentialJitterBackoff(Random random) {
        this.random = random;
    }

    @Override
    public Duration waitAfter(int attempt, RetryPolicy policy) {
        long min = policy.minWait().toMillis();
        long max = policy.maxWait().toMillis();
        long backoff = exponential(min, max, attempt);

        long jitter = backoff / 4;
        if (jitter > 0) {
            backoff = backoff - jitter + random.nextLong(2 * jitter + 1);
        }
        return Duration.ofMillis(Math.max(min, Math.min(max, backoff)));
    }

    static long exponential(long min, long max, int attempt) {
        if (min == 0) {
            return 0;
        }
        if (attempt >= 62 || min > (max >> Math.min(attempt, 62))) {
            return max;
        }
        return Math.min(max, min << attempt);
    }
}
