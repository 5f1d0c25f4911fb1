package io.github.drompincen.polarionclient.protocol.api;

import java.util.Objects;

/**
 * Path components of an enumeration, e.g. {@code workitem/status/requirement}.
 * Use {@code ~} as target type for enumerations that are not type specific.
 */
public record EnumerationId(String context, String name, String targetType) {

    public EnumerationId {
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(targetType, "targetType");
    }

    public static EnumerationId workItem(String name, String targetType) {
        return new EnumerationId("workitem", name, targetType);
    }

    public String path() {
        return context + "/" + name + "/" + targetType;
    }

    @Override
    public String toString() {
        return path();
    }
}
