package io.github.drompincen.polarionclient.runtime.retry;

/**
 * Observes retry decisions. The executor itself does not log.
 */
public interface RetryListener {

    RetryListener NONE = new RetryListener() {};

    /** Called after a transient failure, before waiting {@link RetryState#nextWait()}. */
    default void onRetry(String operation, RetryState state) {}

    /** Called once when the last allowed attempt failed. */
    default void onExhausted(String operation, RetryState state) {}
}
