package io.github.drompincen.polarionclient.runtime.retry;

import io.github.drompincen.polarionclient.runtime.error.OperationCancelledException;

import java.time.Duration;

/**
 * Suspends between attempts. Must return early with {@link OperationCancelledException}
 * when the token is cancelled.
 */
@FunctionalInterface
public interface Waiter {

    Waiter BLOCKING = (wait, token) -> {
        if (token.await(wait)) {
            throw new OperationCancelledException("cancelled while waiting to retry");
        }
    };

    void await(Duration wait, CancellationToken token) throws InterruptedException;
}
