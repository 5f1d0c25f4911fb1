package io.github.drompincen.polarionclient.runtime.retry;

import io.github.drompincen.polarionclient.runtime.error.OperationCancelledException;
import io.github.drompincen.polarionclient.runtime.error.PolarionException;
import io.github.drompincen.polarionclient.runtime.error.RetryExhaustedException;

import java.time.Duration;
import java.util.Objects;

/**
 * Runs an operation, retrying transient failures with exponential backoff.
 *
 * <ul>
 *   <li>success returns the result;</li>
 *   <li>a failure rejected by {@link RetryPolicy#retryIf()} is rethrown unchanged after one attempt
 *       (checked exceptions are wrapped in {@link PolarionException});</li>
 *   <li>a transient failure on the last allowed attempt raises {@link RetryExhaustedException};</li>
 *   <li>cancellation before or during an attempt or wait raises {@link OperationCancelledException}.</li>
 * </ul>
 *
 * Thread-safe; all per-call state lives in a {@link RetryState}.
 */
public final class RetryExecutor {

    private final BackoffStrategy backoff;
    private final Waiter waiter;
    private final RetryListener listener;

    public RetryExecutor() {
        this(new ExponentialJitterBackoff(), Waiter.BLOCKING, RetryListener.NONE);
    }

    public RetryExecutor(RetryListener listener) {
        this(new ExponentialJitterBackoff(), Waiter.BLOCKING, listener);
    }

    public RetryExecutor(BackoffStrategy backoff, Waiter waiter, RetryListener listener) {
        this.backoff = Objects.requireNonNull(backoff, "backoff");
        this.waiter = Objects.requireNonNull(waiter, "waiter");
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    public <T> T execute(String operation, RetryableOperation<T> action, RetryPolicy policy) {
        return execute(operation, action, policy, CancellationToken.create());
    }

    public <T> T execute(String operation, RetryableOperation<T> action, RetryPolicy policy, CancellationToken token) {
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(policy, "policy");
        Objects.requireNonNull(token, "token");
        RetryState state = new RetryState();

        for (int attempt = 0; ; attempt++) {
            if (token.isCancelled()) {
                throw cancelled(operation, state, null);
            }
            state.startAttempt();
            try {
                return action.call(token);
            } catch (OperationCancelledException e) {
                throw e;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw cancelled(operation, state, e);
            } catch (Exception e) {
                if (token.isCancelled()) {
                    throw cancelled(operation, state, e);
                }
                state.failed(e);
                if (!policy.retryIf().test(e)) {
                    throw rethrow(e);
                }
                if (attempt >= policy.maxRetries()) {
                    listener.onExhausted(operation, state);
                    throw new RetryExhaustedException(state.attempts(), e);
                }
                Duration wait = backoff.waitAfter(attempt, policy);
                state.waiting(wait);
                listener.onRetry(operation, state);
                pause(operation, wait, token, state);
            }
        }
    }

    private void pause(String operation, Duration wait, CancellationToken token, RetryState state) {
        if (wait.isZero()) {
            return;
        }
        try {
            waiter.await(wait, token);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw cancelled(operation, state, e);
        }
    }

    private static OperationCancelledException cancelled(String operation, RetryState state, Throwable cause) {
        return new OperationCancelledException(operation + " cancelled after " + state.attempts() + " attempt(s)", cause);
    }

    private static RuntimeException rethrow(Exception e) {
        if (e instanceof RuntimeException runtime) {
            return runtime;
        }
        return new PolarionException(e.getMessage(), e);
    }
}
