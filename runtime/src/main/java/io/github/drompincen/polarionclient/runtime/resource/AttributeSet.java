package io.github.drompincen.polarionclient.runtime.resource;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.polarionclient.runtime.schema.FieldDefinition;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Attributes of a resource: typed values of schema-known fields plus a bag of dynamic
 * (server-defined) entries kept as raw JSON.
 *
 * <p>Each field is in one of three states: unset, set, or explicitly cleared. Cleared fields
 * are sent as JSON {@code null}; unset ones are not sent at all.
 */
public final class AttributeSet {

    private final Map<String, Object> known = new LinkedHashMap<>();
    private final Map<String, JsonNode> dynamic = new LinkedHashMap<>();
    private final Set<String> cleared = new LinkedHashSet<>();

    public <T> Optional<T> get(FieldDefinition<T> field) {
        return Optional.ofNullable(field.type().cast(known.get(field.name())));
    }

    public <T> T getOrNull(FieldDefinition<T> field) {
        return get(field).orElse(null);
    }

    /**
     * Sets a known field. An empty value (per the field type) leaves the field unset.
     */
    public <T> AttributeSet set(FieldDefinition<T> field, T value) {
        cleared.remove(field.name());
        if (field.type().isEmpty(value)) {
            known.remove(field.name());
        } else {
            known.put(field.name(), value);
        }
        return this;
    }

    public AttributeSet unset(FieldDefinition<?> field) {
        known.remove(field.name());
        cleared.remove(field.name());
        return this;
    }

    public AttributeSet clear(FieldDefinition<?> field) {
        known.remove(field.name());
        cleared.add(field.name());
        return this;
    }

    public boolean has(FieldDefinition<?> field) {
        return known.containsKey(field.name());
    }

    public Set<String> knownNames() {
        return Collections.unmodifiableSet(known.keySet());
    }

    public Optional<JsonNode> getDynamic(String name) {
        return Optional.ofNullable(dynamic.get(name));
    }

    public AttributeSet setDynamic(String name, JsonNode value) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
        cleared.remove(name);
        dynamic.put(name, value);
        return this;
    }

    public AttributeSet removeDynamic(String name) {
        dynamic.remove(name);
        cleared.remove(name);
        return this;
    }

    public AttributeSet clearDynamic(String name) {
        dynamic.remove(name);
        cleared.add(name);
        return this;
    }

    public boolean hasDynamic(String name) {
        return dynamic.containsKey(name);
    }

    public Map<String, JsonNode> dynamicEntries() {
        return Collections.unmodifiableMap(dynamic);
    }

    public boolean isCleared(String name) {
        return cleared.contains(name);
    }

    public Set<String> clearedNames() {
        return Collections.unmodifiableSet(cleared);
    }

    public boolean isEmpty() {
        return known.isEmpty() && dynamic.isEmpty() && cleared.isEmpty();
    }

    /** Known values are immutable, so only dynamic JSON needs a deep copy. */
    public AttributeSet copy() {
        AttributeSet copy = new AttributeSet();
        copy.known.putAll(known);
        dynamic.forEach((k, v) -> copy.dynamic.put(k, v.deepCopy()));
        copy.cleared.addAll(cleared);
        return copy;
    }

    @Override
    public String toString() {
        return "AttributeSet{known=" + known + ", dynamic=" + dynamic + ", cleared=" + cleared + '}';
    }
}
