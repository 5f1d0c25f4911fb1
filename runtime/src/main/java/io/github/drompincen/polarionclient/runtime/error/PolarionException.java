package io.github.drompincen.polarionclient.runtime.error;

/**
 * Root of every failure raised by the client.
 */
public class PolarionException extends RuntimeException {

    public PolarionException(String message) {
        super(message);
    }

    public PolarionException(String message, Throwable cause) {
        super(message, cause);
    }
}
