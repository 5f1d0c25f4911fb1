package io.github.drompincen.polarionclient.runtime.schema;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Allow-list of the attributes and relationships a resource type knows statically.
 * Every other wire key is treated as dynamic.
 */
public final class ResourceSchema {

    private final String type;
    private final Map<String, FieldDefinition<?>> fields;
    private final Set<String> relationships;

    private ResourceSchema(String type, Map<String, FieldDefinition<?>> fields, Set<String> relationships) {
        this.type = type;
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        this.relationships = Collections.unmodifiableSet(new LinkedHashSet<>(relationships));
    }

    public static Builder builder(String type) {
        return new Builder(type);
    }

    public String type() {
        return type;
    }

    public Collection<FieldDefinition<?>> fields() {
        return fields.values();
    }

    public Optional<FieldDefinition<?>> field(String name) {
        return Optional.ofNullable(fields.get(name));
    }

    public boolean isKnownAttribute(String name) {
        return fields.containsKey(name);
    }

    public Set<String> relationships() {
        return relationships;
    }

    public boolean isKnownRelationship(String name) {
        return relationships.contains(name);
    }

    @Override
    public String toString() {
        return "ResourceSchema{" + type + ", fields=" + fields.keySet() + ", relationships=" + relationships + '}';
    }

    public static final class Builder {
        private final String type;
        private final Map<String, FieldDefinition<?>> fields = new LinkedHashMap<>();
        private final Set<String> relationships = new LinkedHashSet<>();

        private Builder(String type) {
            this.type = Objects.requireNonNull(type, "type");
        }

        public Builder field(FieldDefinition<?> definition) {
            if (relationships.contains(definition.name()) || fields.putIfAbsent(definition.name(), definition) != null) {
                throw new IllegalArgumentException("Duplicate field '" + definition.name() + "' in " + type + " schema");
            }
            return this;
        }

        public Builder fields(FieldDefinition<?>... definitions) {
            for (FieldDefinition<?> d : definitions) {
                field(d);
            }
            return this;
        }

        public Builder relationships(String... names) {
            for (String name : names) {
                if (fields.containsKey(name) || !relationships.add(name)) {
                    throw new IllegalArgumentException("Duplicate relationship '" + name + "' in " + type + " schema");
                }
            }
            return this;
        }

        public ResourceSchema build() {
            return new ResourceSchema(type, fields, relationships);
        }
    }
}
