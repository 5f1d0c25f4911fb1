package io.github.drompincen.polarionclient.runtime.resource;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.polarionclient.runtime.schema.FieldDefinition;

import java.util.Objects;
import java.util.Optional;

/**
 * A JSON:API resource object. Created locally with no id, or hydrated from a response.
 * Not thread-safe; callers mutate it in place.
 */
public class Resource {

    private final String type;
    private String id;
    private String revision;
    private final AttributeSet attributes;
    private final RelationshipSet relationships;
    private JsonNode links;
    private JsonNode meta;

    public Resource(String type) {
        this(type, null, null, new AttributeSet(), new RelationshipSet(), null, null);
    }

    public Resource(String type, String id, String revision, AttributeSet attributes,
                    RelationshipSet relationships, JsonNode links, JsonNode meta) {
        this.type = Objects.requireNonNull(type, "type");
        this.id = id;
        this.revision = revision;
        this.attributes = attributes != null ? attributes : new AttributeSet();
        this.relationships = relationships != null ? relationships : new RelationshipSet();
        this.links = links;
        this.meta = meta;
    }

    public String getType() { return type; }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getRevision() { return revision; }
    public void setRevision(String revision) { this.revision = revision; }

    public AttributeSet attributes() { return attributes; }

    public RelationshipSet relationships() { return relationships; }

    public JsonNode getLinks() { return links; }
    public void setLinks(JsonNode links) { this.links = links; }

    public JsonNode getMeta() { return meta; }
    public void setMeta(JsonNode meta) { this.meta = meta; }

    public boolean isNew() {
        return id == null || id.isEmpty();
    }

    /**
     * Last path segment of the id: {@code "PROJ/WI-1"} becomes {@code "WI-1"}.
     */
    public String shortId() {
        return shortId(id);
    }

    public static String shortId(String id) {
        if (id == null) {
            return null;
        }
        int slash = id.lastIndexOf('/');
        return slash >= 0 ? id.substring(slash + 1) : id;
    }

    public Optional<String> selfLink() {
        if (links == null || !links.hasNonNull("self")) {
            return Optional.empty();
        }
        return Optional.of(links.get("self").asText());
    }

    public <T> Optional<T> get(FieldDefinition<T> field) {
        return attributes.get(field);
    }

    public <T> Resource set(FieldDefinition<T> field, T value) {
        attributes.set(field, value);
        return this;
    }

    public Resource copy() {
        return new Resource(type, id, revision, attributes.copy(), relationships.copy(),
                links == null ? null : links.deepCopy(),
                meta == null ? null : meta.deepCopy());
    }

    @Override
    public String toString() {
        return "Resource{" + type + "/" + id + (revision != null ? "@" + revision : "") + '}';
    }
}
