package io.github.drompincen.polarionclient.runtime.error;

public class OperationCancelledException extends PolarionException {

    public OperationCancelledException(String message) {
        super(message);
    }

    public OperationCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
