package io.github.drompincen.polarionclient.runtime.resource;

import io.github.drompincen.polarionclient.protocol.api.ResourceRef;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Relationships of a resource, split like {@link AttributeSet} into schema-known and dynamic
 * entries.
 */
public final class RelationshipSet {

    private final Map<String, Relationship> known = new LinkedHashMap<>();
    private final Map<String, Relationship> dynamic = new LinkedHashMap<>();
    private final Set<String> cleared = new LinkedHashSet<>();

    public Optional<Relationship> get(String name) {
        Relationship r = known.get(name);
        return Optional.ofNullable(r != null ? r : dynamic.get(name));
    }

    public List<ResourceRef> refs(String name) {
        return get(name).map(Relationship::refs).orElse(List.of());
    }

    public RelationshipSet set(String name, Relationship relationship) {
        put(known, name, relationship);
        return this;
    }

    public RelationshipSet setSingle(String name, ResourceRef ref) {
        return set(name, Relationship.single(ref));
    }

    public RelationshipSet setList(String name, List<ResourceRef> refs) {
        return set(name, Relationship.list(refs));
    }

    public RelationshipSet setDynamic(String name, Relationship relationship) {
        put(dynamic, name, relationship);
        return this;
    }

    public RelationshipSet remove(String name) {
        known.remove(name);
        dynamic.remove(name);
        cleared.remove(name);
        return this;
    }

    /** Marks the relationship to be sent as {@code "data": null}. */
    public RelationshipSet clear(String name) {
        known.remove(name);
        dynamic.remove(name);
        cleared.add(name);
        return this;
    }

    public boolean isCleared(String name) {
        return cleared.contains(name);
    }

    public Set<String> clearedNames() {
        return Collections.unmodifiableSet(cleared);
    }

    public Map<String, Relationship> knownEntries() {
        return Collections.unmodifiableMap(known);
    }

    public Map<String, Relationship> dynamicEntries() {
        return Collections.unmodifiableMap(dynamic);
    }

    public boolean isEmpty() {
        return known.isEmpty() && dynamic.isEmpty() && cleared.isEmpty();
    }

    public RelationshipSet copy() {
        RelationshipSet copy = new RelationshipSet();
        known.forEach((k, v) -> copy.known.put(k, v.deepCopy()));
        dynamic.forEach((k, v) -> copy.dynamic.put(k, v.deepCopy()));
        copy.cleared.addAll(cleared);
        return copy;
    }

    private void put(Map<String, Relationship> target, String name, Relationship relationship) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(relationship, "relationship");
        cleared.remove(name);
        target.put(name, relationship);
    }

    @Override
    public String toString() {
        return "RelationshipSet{known=" + known.keySet() + ", dynamic=" + dynamic.keySet() + ", cleared=" + cleared + '}';
    }
}
