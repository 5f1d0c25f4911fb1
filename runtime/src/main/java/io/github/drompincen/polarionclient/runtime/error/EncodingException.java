package io.github.drompincen.polarionclient.runtime.error;

public class EncodingException extends PolarionException {

    public EncodingException(String message) {
        super(message);
    }

    public EncodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
