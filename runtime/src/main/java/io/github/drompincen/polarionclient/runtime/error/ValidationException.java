package io.github.drompincen.polarionclient.runtime.error;

public class ValidationException extends PolarionException {

    private final String field;

    public ValidationException(String field, String message) {
        super("validation error on field '" + field + "': " + message);
        this.field = field;
    }

    public String field() {
        return field;
    }
}
