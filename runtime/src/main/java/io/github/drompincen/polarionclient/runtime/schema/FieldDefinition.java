package io.github.drompincen.polarionclient.runtime.schema;

import java.util.Objects;

/**
 * Typed key of a known attribute. Read-only fields are decoded but never sent in writes.
 */
public record FieldDefinition<T>(String name, FieldType<T> type, boolean readOnly) {

    public FieldDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Field name must not be blank");
        }
    }

    public static <T> FieldDefinition<T> of(String name, FieldType<T> type) {
        return new FieldDefinition<>(name, type, false);
    }

    public static <T> FieldDefinition<T> readOnly(String name, FieldType<T> type) {
        return new FieldDefinition<>(name, type, true);
    }
}
