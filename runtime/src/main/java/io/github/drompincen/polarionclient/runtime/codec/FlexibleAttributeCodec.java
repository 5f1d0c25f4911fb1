package io.github.drompincen.polarionclient.runtime.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.polarionclient.protocol.api.ResourceRef;
import io.github.drompincen.polarionclient.runtime.error.EncodingException;
import io.github.drompincen.polarionclient.runtime.error.FieldCollisionException;
import io.github.drompincen.polarionclient.runtime.error.ResponseDecodingException;
import io.github.drompincen.polarionclient.runtime.resource.AttributeSet;
import io.github.drompincen.polarionclient.runtime.resource.Relationship;
import io.github.drompincen.polarionclient.runtime.resource.RelationshipSet;
import io.github.drompincen.polarionclient.runtime.resource.Resource;
import io.github.drompincen.polarionclient.runtime.schema.FieldDefinition;
import io.github.drompincen.polarionclient.runtime.schema.ResourceSchema;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Converts JSON:API resource objects to {@link Resource} and back for one {@link ResourceSchema}.
 *
 * <p>Attribute keys declared by the schema decode into typed values; every other key is kept
 * verbatim as a dynamic entry and merged back into the same flat {@code attributes} object on
 * encode. Decoding then encoding in {@link EncodeMode#FULL} reproduces the input up to key
 * order, provided known values are in canonical form (JSON null and empty known values are
 * dropped, timestamps are re-rendered in ISO offset form).
 *
 * <p>Instances hold no mutable state and may be shared between threads.
 */
public final class FlexibleAttributeCodec {

    private final ResourceSchema schema;
    private final ObjectMapper mapper;

    public FlexibleAttributeCodec(ResourceSchema schema, ObjectMapper mapper) {
        this.schema = Objects.requireNonNull(schema, "schema");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public ResourceSchema schema() {
        return schema;
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    // ---- attributes ----

    public AttributeSet decodeAttributes(JsonNode node) {
        AttributeSet attributes = new AttributeSet();
        if (node == null || node.isNull() || node.isMissingNode()) {
            return attributes;
        }
        if (!node.isObject()) {
            throw new ResponseDecodingException(schema.type() + " attributes must be an object, got " + node.getNodeType());
        }
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            var definition = schema.field(entry.getKey());
            if (definition.isPresent()) {
                decodeKnown(definition.get(), entry.getValue(), attributes);
            } else {
                attributes.setDynamic(entry.getKey(), entry.getValue().deepCopy());
            }
        }
        return attributes;
    }

    public ObjectNode encodeAttributes(AttributeSet attributes) {
        return encodeAttributes(attributes, EncodeMode.FULL);
    }

    /**
     * @throws FieldCollisionException when a dynamic entry uses the name of a known attribute
     * @throws EncodingException when a known value is not declared by this schema
     */
    public ObjectNode encodeAttributes(AttributeSet attributes, EncodeMode mode) {
        ObjectNode out = mapper.createObjectNode();
        for (String name : attributes.knownNames()) {
            if (!schema.isKnownAttribute(name)) {
                throw new EncodingException("Attribute '" + name + "' is not declared by the " + schema.type() + " schema");
            }
        }
        for (FieldDefinition<?> definition : schema.fields()) {
            if (definition.readOnly() && !mode.includesReadOnly()) {
                continue;
            }
            if (attributes.has(definition)) {
                out.set(definition.name(), encodeKnown(definition, attributes));
            } else if (attributes.isCleared(definition.name())) {
                out.putNull(definition.name());
            }
        }
        for (Map.Entry<String, JsonNode> entry : attributes.dynamicEntries().entrySet()) {
            checkDynamicAttribute(entry.getKey());
            out.set(entry.getKey(), entry.getValue().deepCopy());
        }
        for (String name : attributes.clearedNames()) {
            if (!schema.isKnownAttribute(name)) {
                out.putNull(name);
            }
        }
        return out;
    }

    // ---- relationships ----

    public RelationshipSet decodeRelationships(JsonNode node) {
        RelationshipSet relationships = new RelationshipSet();
        if (node == null || node.isNull() || node.isMissingNode()) {
            return relationships;
        }
        if (!node.isObject()) {
            throw new ResponseDecodingException(schema.type() + " relationships must be an object, got " + node.getNodeType());
        }
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            Relationship relationship = decodeRelationship(entry.getKey(), entry.getValue());
            if (schema.isKnownRelationship(entry.getKey())) {
                relationships.set(entry.getKey(), relationship);
            } else {
                relationships.setDynamic(entry.getKey(), relationship);
            }
        }
        return relationships;
    }

    public ObjectNode encodeRelationships(RelationshipSet relationships, EncodeMode mode) {
        ObjectNode out = mapper.createObjectNode();
        for (Map.Entry<String, Relationship> entry : relationships.knownEntries().entrySet()) {
            if (!schema.isKnownRelationship(entry.getKey())) {
                throw new EncodingException("Relationship '" + entry.getKey() + "' is not declared by the "
                        + schema.type() + " schema");
            }
            encodeRelationship(out, entry.getKey(), entry.getValue(), mode);
        }
        for (Map.Entry<String, Relationship> entry : relationships.dynamicEntries().entrySet()) {
            checkDynamicRelationship(entry.getKey());
            encodeRelationship(out, entry.getKey(), entry.getValue(), mode);
        }
        for (String name : relationships.clearedNames()) {
            out.putObject(name).putNull("data");
        }
        return out;
    }

    // ---- whole resource ----

    public Resource decode(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new ResponseDecodingException("Expected a " + schema.type() + " resource object");
        }
        String type = node.path("type").asText(null);
        if (type == null) {
            throw new ResponseDecodingException("Resource object has no type");
        }
        if (!schema.type().equals(type)) {
            throw new ResponseDecodingException("Expected resource type " + schema.type() + " but got " + type);
        }
        return new Resource(type,
                textOrNull(node, "id"),
                textOrNull(node, "revision"),
                decodeAttributes(node.get("attributes")),
                decodeRelationships(node.get("relationships")),
                copyOrNull(node.get("links")),
                copyOrNull(node.get("meta")));
    }

    public Resource decode(byte[] json) {
        try {
            return decode(mapper.readTree(json));
        } catch (IOException e) {
            throw new ResponseDecodingException("Malformed " + schema.type() + " JSON: " + e.getMessage(), e);
        }
    }

    public List<Resource> decodeAll(JsonNode data) {
        if (data == null || data.isNull() || data.isMissingNode()) {
            return List.of();
        }
        if (!data.isArray()) {
            throw new ResponseDecodingException("Expected an array of " + schema.type() + " resources");
        }
        List<Resource> out = new ArrayList<>(data.size());
        for (JsonNode item : data) {
            out.add(decode(item));
        }
        return out;
    }

    public ObjectNode encode(Resource resource, EncodeMode mode) {
        if (!schema.type().equals(resource.getType())) {
            throw new EncodingException("Cannot encode " + resource.getType() + " with the " + schema.type() + " schema");
        }
        ObjectNode out = mapper.createObjectNode();
        out.put("type", resource.getType());
        if (!resource.isNew()) {
            out.put("id", resource.getId());
        }
        if (mode.includesDocumentMembers() && resource.getRevision() != null) {
            out.put("revision", resource.getRevision());
        }
        ObjectNode attributes = encodeAttributes(resource.attributes(), mode);
        if (!attributes.isEmpty() || mode == EncodeMode.CREATE) {
            out.set("attributes", attributes);
        }
        ObjectNode relationships = encodeRelationships(resource.relationships(), mode);
        if (!relationships.isEmpty()) {
            out.set("relationships", relationships);
        }
        if (mode.includesDocumentMembers()) {
            if (resource.getLinks() != null) {
                out.set("links", resource.getLinks().deepCopy());
            }
            if (resource.getMeta() != null) {
                out.set("meta", resource.getMeta().deepCopy());
            }
        }
        return out;
    }

    public byte[] toBytes(JsonNode node) {
        try {
            return mapper.writeValueAsBytes(node);
        } catch (JsonProcessingException e) {
            throw new EncodingException("Cannot serialize " + schema.type() + " JSON", e);
        }
    }

    /** Size in bytes of the compact UTF-8 encoding. */
    public int encodedSize(Resource resource, EncodeMode mode) {
        return toBytes(encode(resource, mode)).length;
    }

    // ---- helpers ----

    private <T> void decodeKnown(FieldDefinition<T> definition, JsonNode node, AttributeSet target) {
        T value;
        try {
            value = definition.type().decode(node, mapper);
        } catch (IllegalArgumentException e) {
            throw new ResponseDecodingException("Attribute '" + definition.name() + "' of " + schema.type()
                    + " is not a valid " + definition.type().name() + ": " + e.getMessage(), e);
        }
        target.set(definition, value);
    }

    private <T> JsonNode encodeKnown(FieldDefinition<T> definition, AttributeSet attributes) {
        try {
            return definition.type().encode(attributes.getOrNull(definition), mapper);
        } catch (IllegalArgumentException e) {
            throw new EncodingException("Attribute '" + definition.name() + "' cannot be encoded: " + e.getMessage(), e);
        }
    }

    // attributes and relationships are separate JSON objects, names only clash within one of them
    private void checkDynamicAttribute(String name) {
        if (schema.isKnownAttribute(name)) {
            throw new FieldCollisionException(schema.type(), name);
        }
    }

    private void checkDynamicRelationship(String name) {
        if (schema.isKnownRelationship(name)) {
            throw new FieldCollisionException(schema.type(), name);
        }
    }

    private Relationship decodeRelationship(String name, JsonNode node) {
        if (!node.isObject()) {
            throw new ResponseDecodingException("Relationship '" + name + "' must be an object");
        }
        JsonNode links = copyOrNull(node.get("links"));
        JsonNode meta = copyOrNull(node.get("meta"));
        if (!node.has("data")) {
            return new Relationship(Relationship.Shape.LINKS_ONLY, List.of(), links, meta);
        }
        JsonNode data = node.get("data");
        if (data.isNull()) {
            return new Relationship(Relationship.Shape.NULL, List.of(), links, meta);
        }
        if (data.isObject()) {
            return new Relationship(Relationship.Shape.SINGLE, List.of(decodeRef(name, data)), links, meta);
        }
        if (data.isArray()) {
            List<ResourceRef> refs = new ArrayList<>(data.size());
            for (JsonNode item : data) {
                refs.add(decodeRef(name, item));
            }
            return new Relationship(Relationship.Shape.LIST, refs, links, meta);
        }
        throw new ResponseDecodingException("Relationship '" + name + "' data must be an object, an array or null");
    }

    private ResourceRef decodeRef(String relationship, JsonNode node) {
        if (!node.path("type").isTextual() || !node.path("id").isTextual()) {
            throw new ResponseDecodingException("Relationship '" + relationship
                    + "' contains a reference without type or id: " + node);
        }
        return new ResourceRef(node.get("type").textValue(), node.get("id").textValue());
    }

    private void encodeRelationship(ObjectNode out, String name, Relationship relationship, EncodeMode mode) {
        if (!relationship.hasData() && !mode.includesDocumentMembers()) {
            return;
        }
        ObjectNode entry = out.putObject(name);
        switch (relationship.shape()) {
            case SINGLE -> entry.set("data", refNode(relationship.refs().get(0)));
            case LIST -> {
                ArrayNode array = entry.putArray("data");
                relationship.refs().forEach(ref -> array.add(refNode(ref)));
            }
            case NULL -> entry.putNull("data");
            case LINKS_ONLY -> { }
        }
        if (mode.includesDocumentMembers()) {
            if (relationship.links() != null) {
                entry.set("links", relationship.links().deepCopy());
            }
            if (relationship.meta() != null) {
                entry.set("meta", relationship.meta().deepCopy());
            }
        }
    }

    private ObjectNode refNode(ResourceRef ref) {
        ObjectNode node = mapper.createObjectNode();
        node.put("type", ref.type());
        node.put("id", ref.id());
        return node;
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static JsonNode copyOrNull(JsonNode node) {
        return node == null || node.isNull() ? null : node.deepCopy();
    }
}
