package io.github.drompincen.polarionclient.runtime.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Wire conversion and comparison rules for one kind of attribute value.
 * Implementations must be stateless.
 *
 * @param <T> Java representation of the value
 */
public interface FieldType<T> {

    String name();

    Class<T> javaType();

    JsonNode encode(T value, ObjectMapper mapper);

    /**
     * @throws IllegalArgumentException when the node does not hold a value of this type
     */
    T decode(JsonNode node, ObjectMapper mapper);

    /**
     * Empty values are omitted on encode and treated as "not touched" by the diff engine.
     */
    boolean isEmpty(T value);

    boolean sameValue(T a, T b);

    default T cast(Object value) {
        if (value == null) {
            return null;
        }
        if (!javaType().isInstance(value)) {
            throw new IllegalArgumentException("Expected " + javaType().getSimpleName()
                    + " for " + name() + " field but got " + value.getClass().getSimpleName());
        }
        return javaType().cast(value);
    }
}
