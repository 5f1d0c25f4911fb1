package io.github.drompincen.polarionclient.protocol.api;

import java.util.Objects;

/**
 * Typed pointer to another resource, serialized as {@code {"type": ..., "id": ...}}.
 */
public record ResourceRef(String type, String id) {

    public ResourceRef {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(id, "id");
    }

    public static ResourceRef of(String type, String id) {
        return new ResourceRef(type, id);
    }

    public static ResourceRef user(String userId) {
        return new ResourceRef("users", userId);
    }

    public static ResourceRef workItem(String workItemId) {
        return new ResourceRef("workitems", workItemId);
    }
}
