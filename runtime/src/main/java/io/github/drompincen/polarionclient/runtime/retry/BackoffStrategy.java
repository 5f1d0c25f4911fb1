package io.github.drompincen.polarionclient.runtime.retry;

import java.time.Duration;

@FunctionalInterface
public interface BackoffStrategy {

    /**
     * @param attempt zero-based index of the attempt that just failed
     */
    Duration waitAfter(int attempt, RetryPolicy policy);
}
