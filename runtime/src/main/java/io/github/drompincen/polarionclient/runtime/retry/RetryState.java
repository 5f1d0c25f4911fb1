package io.github.drompincen.polarionclient.runtime.retry;

import java.time.Duration;

/**
 * Progress of one retried operation. Owned by a single {@link RetryExecutor#execute} call.
 */
public final class RetryState {

    private int attempts;
    private Throwable lastError;
    private Duration nextWait = Duration.ZERO;

    RetryState() {}

    /** Attempts started so far, including the current one. */
    public int attempts() {
        return attempts;
    }

    public Throwable lastError() {
        return lastError;
    }

    public Duration nextWait() {
        return nextWait;
    }

    void startAttempt() {
        attempts++;
        nextWait = Duration.ZERO;
    }

    void failed(Throwable error) {
        lastError = error;
    }

    void waiting(Duration wait) {
        nextWait = wait;
    }

    @Override
    public String toString() {
        return "RetryState{attempts=" + attempts + ", nextWait=" + nextWait
                + ", lastError=" + (lastError == null ? null : lastError.getMessage()) + '}';
    }
}
