package io.github.drompincen.polarionclient.runtime.error;

/**
 * A dynamic attribute or relationship uses a name the schema already declares in the same partition.
 */
public class FieldCollisionException extends EncodingException {

    private final String fieldName;

    public FieldCollisionException(String resourceType, String fieldName) {
        super("Dynamic field '" + fieldName + "' collides with a known " + resourceType + " field");
        this.fieldName = fieldName;
    }

    public String fieldName() {
        return fieldName;
    }
}
