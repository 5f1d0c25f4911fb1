package io.github.drompincen.polarionclient.runtime.error;

public class ResponseDecodingException extends PolarionException {

    public ResponseDecodingException(String message) {
        super(message);
    }

    public ResponseDecodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
