package io.github.drompincen.polarionclient.runtime.retry;

@FunctionalInterface
public interface RetryableOperation<T> {

    T call(CancellationToken token) throws Exception;
}
