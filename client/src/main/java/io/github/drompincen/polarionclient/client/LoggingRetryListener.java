package io.github.drompincen.polarionclient.client;

import io.github.drompincen.polarionclient.runtime.retry.RetryListener;
import io.github.drompincen.polarionclient.runtime.retry.RetryState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class LoggingRetryListener implements RetryListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingRetryListener.class);

    @Override
    public void onRetry(String operation, RetryState state) {
        log.warn("{} failed on attempt {} ({}), retrying in {} ms", operation, state.attempts(),
                state.lastError().getMessage(), state.nextWait().toMillis());
    }

    @Override
    public void onExhausted(String operation, RetryState state) {
        log.warn("{} gave up after {} attempts: {}", operation, state.attempts(), state.lastError().getMessage());
    }
}
