package io.github.drompincen.polarionclient.runtime.retry;

import io.github.drompincen.polarionclient.runtime.error.ApiException;
import io.github.drompincen.polarionclient.runtime.error.TransportException;

import java.io.IOException;

/**
 * Default classification of failures: network errors, HTTP 429 and 5xx are transient;
 * other 4xx responses and client-side errors are permanent.
 */
public final class Retryability {

    private Retryability() {}

    public static boolean isRetryable(Throwable error) {
        if (error instanceof ApiException api) {
            return isRetryableStatus(api.statusCode());
        }
        return error instanceof TransportException || error instanceof IOException;
    }

    public static boolean isRetryableStatus(int status) {
        return status == 429 || status >= 500;
    }
}
