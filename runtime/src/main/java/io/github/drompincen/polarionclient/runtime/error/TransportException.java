package io.github.drompincen.polarionclient.runtime.error;

/**
 * The request never produced an HTTP response (connection refused, reset, timeout).
 */
public class TransportException extends PolarionException {

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
