package io.github.drompincen.polarionclient.runtime.error;

public class RetryExhaustedException extends PolarionException {

    private final int attempts;

    public RetryExhaustedException(int attempts, Throwable lastFailure) {
        super("max retries exceeded after " + attempts + " attempts: " + lastFailure.getMessage(), lastFailure);
        this.attempts = attempts;
    }

    public int attempts() {
        return attempts;
    }
}
