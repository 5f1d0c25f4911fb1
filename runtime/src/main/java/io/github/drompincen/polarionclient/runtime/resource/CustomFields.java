package io.github.drompincen.polarionclient.runtime.resource;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.polarionclient.protocol.api.TextContent;
import io.github.drompincen.polarionclient.protocol.field.TableField;
import io.github.drompincen.polarionclient.runtime.schema.FieldType;
import io.github.drompincen.polarionclient.runtime.schema.FieldTypes;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.Set;

/**
 * Typed access to the dynamic attributes of a resource. Getters return empty when the field is
 * missing, null, or holds a value of another shape.
 */
public final class CustomFields {

    private final AttributeSet attributes;
    private final ObjectMapper mapper;

    public CustomFields(AttributeSet attributes, ObjectMapper mapper) {
        this.attributes = attributes;
        this.mapper = mapper;
    }

    public <T> Optional<T> get(String name, FieldType<T> type) {
        JsonNode node = attributes.getDynamic(name).orElse(null);
        if (node == null || node.isNull()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(type.decode(node, mapper));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    public Optional<String> getString(String name) {
        return attributes.getDynamic(name).filter(JsonNode::isTextual).map(JsonNode::textValue);
    }

    /** Enumeration values arrive either as the option id or as {@code {"id": ...}}. */
    public Optional<String> getEnum(String name) {
        Optional<JsonNode> node = attributes.getDynamic(name);
        if (node.isPresent() && node.get().isObject() && node.get().path("id").isTextual()) {
            return Optional.of(node.get().get("id").textValue());
        }
        return getString(name);
    }

    public Optional<Long> getInteger(String name) {
        return get(name, FieldTypes.INTEGER);
    }

    /** Accepts numeric strings, which is how currency fields are sent. */
    public Optional<BigDecimal> getDecimal(String name) {
        return get(name, FieldTypes.DECIMAL);
    }

    public Optional<Boolean> getBoolean(String name) {
        return get(name, FieldTypes.BOOLEAN);
    }

    public Optional<TextContent> getText(String name) {
        return attributes.getDynamic(name).filter(JsonNode::isObject).flatMap(n -> get(name, FieldTypes.TEXT));
    }

    public Optional<LocalDate> getDate(String name) {
        return get(name, FieldTypes.DATE);
    }

    public Optional<LocalTime> getTime(String name) {
        return get(name, FieldTypes.TIME);
    }

    public Optional<OffsetDateTime> getDateTime(String name) {
        return get(name, FieldTypes.TIMESTAMP);
    }

    public Optional<Duration> getDuration(String name) {
        return get(name, FieldTypes.DURATION);
    }

    public Optional<TableField> getTable(String name) {
        return attributes.getDynamic(name).filter(JsonNode::isObject).flatMap(n -> get(name, FieldTypes.TABLE));
    }

    public <T> CustomFields set(String name, FieldType<T> type, T value) {
        if (value == null) {
            attributes.removeDynamic(name);
        } else {
            attributes.setDynamic(name, type.encode(value, mapper));
        }
        return this;
    }

    /**
     * Sets a value of any JSON-serializable type. Time values and durations use the Polarion
     * wire formats. A null value removes the field.
     */
    public CustomFields set(String name, Object value) {
        if (value == null) {
            attributes.removeDynamic(name);
        } else if (value instanceof JsonNode node) {
            attributes.setDynamic(name, node);
        } else if (value instanceof Duration d) {
            set(name, FieldTypes.DURATION, d);
        } else if (value instanceof OffsetDateTime t) {
            set(name, FieldTypes.TIMESTAMP, t);
        } else if (value instanceof LocalTime t) {
            set(name, FieldTypes.TIME, t);
        } else {
            attributes.setDynamic(name, mapper.valueToTree(value));
        }
        return this;
    }

    public boolean has(String name) {
        return attributes.hasDynamic(name);
    }

    public CustomFields remove(String name) {
        attributes.removeDynamic(name);
        return this;
    }

    /** Sends the field as JSON null on the next write. */
    public CustomFields clear(String name) {
        attributes.clearDynamic(name);
        return this;
    }

    public Set<String> names() {
        return attributes.dynamicEntries().keySet();
    }
}
