package io.github.drompincen.polarionclient.runtime.resource;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.polarionclient.protocol.api.ResourceRef;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One relationship entry. Both wire shapes of {@code data} decode to the same reference list;
 * {@link Shape} remembers which one to write back.
 */
public record Relationship(Shape shape, List<ResourceRef> refs, JsonNode links, JsonNode meta) {

    public enum Shape {
        /** {@code "data": {...}} */
        SINGLE,
        /** {@code "data": [...]} */
        LIST,
        /** {@code "data": null} */
        NULL,
        /** no {@code data} member, only links or meta */
        LINKS_ONLY
    }

    public Relationship {
        Objects.requireNonNull(shape, "shape");
        refs = refs == null ? List.of() : List.copyOf(refs);
        if (shape == Shape.SINGLE && refs.size() != 1) {
            throw new IllegalArgumentException("Single relationship must hold exactly one reference, got " + refs.size());
        }
        if ((shape == Shape.NULL || shape == Shape.LINKS_ONLY) && !refs.isEmpty()) {
            throw new IllegalArgumentException(shape + " relationship cannot hold references");
        }
    }

    public static Relationship single(ResourceRef ref) {
        return new Relationship(Shape.SINGLE, List.of(ref), null, null);
    }

    public static Relationship list(List<ResourceRef> refs) {
        return new Relationship(Shape.LIST, refs, null, null);
    }

    public static Relationship list(ResourceRef... refs) {
        return list(List.of(refs));
    }

    public static Relationship none() {
        return new Relationship(Shape.NULL, List.of(), null, null);
    }

    public Optional<ResourceRef> first() {
        return refs.isEmpty() ? Optional.empty() : Optional.of(refs.get(0));
    }

    public boolean hasData() {
        return shape != Shape.LINKS_ONLY;
    }

    public boolean isEmpty() {
        return refs.isEmpty();
    }

    /** Same targets in the same order; links and meta are ignored. */
    public boolean sameRefs(Relationship other) {
        return other != null && refs.equals(other.refs);
    }

    Relationship deepCopy() {
        return new Relationship(shape, refs,
                links == null ? null : links.deepCopy(),
                meta == null ? null : meta.deepCopy());
    }
}
