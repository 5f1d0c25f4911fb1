package io.github.drompincen.polarionclient.runtime.schema;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.github.drompincen.polarionclient.protocol.api.Hyperlink;
import io.github.drompincen.polarionclient.protocol.api.TextContent;
import io.github.drompincen.polarionclient.protocol.field.PolarionDuration;
import io.github.drompincen.polarionclient.protocol.field.TableField;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Objects;
import java.util.function.BiPredicate;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Built-in field types.
 */
public final class FieldTypes {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private FieldTypes() {}

    public static final FieldType<String> STRING = new Scalar<>("string", String.class,
            v -> NODES.textNode(v),
            FieldTypes::requireText,
            v -> v == null || v.isEmpty(),
            Objects::equals);

    /** Booleans are empty only when null, so {@code false} is still sent. */
    public static final FieldType<Boolean> BOOLEAN = new Scalar<>("boolean", Boolean.class,
            v -> NODES.booleanNode(v),
            n -> {
                if (n.isBoolean()) {
                    return n.booleanValue();
                }
                if (n.isTextual() && ("true".equalsIgnoreCase(n.textValue()) || "false".equalsIgnoreCase(n.textValue()))) {
                    return Boolean.parseBoolean(n.textValue());
                }
                throw new IllegalArgumentException("not a boolean: " + n);
            },
            Objects::isNull,
            Objects::equals);

    public static final FieldType<Long> INTEGER = new Scalar<>("integer", Long.class,
            v -> NODES.numberNode(v),
            n -> {
                if (n.isIntegralNumber() || n.canConvertToExactIntegral()) {
                    return n.longValue();
                }
                if (n.isTextual()) {
                    return parse(n.textValue(), Long::valueOf);
                }
                throw new IllegalArgumentException("not an integer: " + n);
            },
            Objects::isNull,
            Objects::equals);

    public static final FieldType<BigDecimal> DECIMAL = new Scalar<>("decimal", BigDecimal.class,
            v -> NODES.numberNode(v),
            n -> {
                if (n.isNumber()) {
                    return n.decimalValue();
                }
                if (n.isTextual()) {
                    return parse(n.textValue(), BigDecimal::new);
                }
                throw new IllegalArgumentException("not a number: " + n);
            },
            Objects::isNull,
            (a, b) -> a == null ? b == null : b != null && a.compareTo(b) == 0);

    /** Timestamps compare by instant, so the same moment in two offsets is unchanged. */
    public static final FieldType<OffsetDateTime> TIMESTAMP = new Scalar<>("date-time", OffsetDateTime.class,
            v -> NODES.textNode(DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(v)),
            n -> parse(requireText(n), OffsetDateTime::parse),
            Objects::isNull,
            (a, b) -> a == null ? b == null : b != null && a.isEqual(b));

    public static final FieldType<LocalDate> DATE = new Scalar<>("date", LocalDate.class,
            v -> NODES.textNode(v.toString()),
            n -> parse(requireText(n), LocalDate::parse),
            Objects::isNull,
            Objects::equals);

    public static final FieldType<LocalTime> TIME = new Scalar<>("time", LocalTime.class,
            v -> NODES.textNode(DateTimeFormatter.ISO_LOCAL_TIME.format(v)),
            n -> parse(requireText(n), LocalTime::parse),
            Objects::isNull,
            Objects::equals);

    public static final FieldType<Duration> DURATION = new Scalar<>("duration", Duration.class,
            v -> NODES.textNode(PolarionDuration.format(v)),
            n -> PolarionDuration.parse(requireText(n)),
            Objects::isNull,
            Objects::equals);

    public static final FieldType<TextContent> TEXT = new Structured<>("text", TextContent.class,
            new TypeReference<TextContent>() {},
            v -> v == null || v.value() == null || v.value().isEmpty());

    public static final FieldType<List<Hyperlink>> HYPERLINKS = new Structured<>("hyperlinks", List.class,
            new TypeReference<List<Hyperlink>>() {},
            v -> v == null || v.isEmpty());

    public static final FieldType<List<String>> STRING_LIST = new Structured<>("string-list", List.class,
            new TypeReference<List<String>>() {},
            v -> v == null || v.isEmpty());

    public static final FieldType<TableField> TABLE = new Structured<>("table", TableField.class,
            new TypeReference<TableField>() {},
            v -> v == null || v.isEmpty());

    private static String requireText(JsonNode node) {
        if (!node.isTextual()) {
            throw new IllegalArgumentException("not a string: " + node);
        }
        return node.textValue();
    }

    private static <T> T parse(String text, Function<String, T> parser) {
        try {
            return parser.apply(text);
        } catch (NumberFormatException | DateTimeParseException e) {
            throw new IllegalArgumentException("cannot parse '" + text + "': " + e.getMessage(), e);
        }
    }

    private record Scalar<T>(
            String name,
            Class<T> javaType,
            Function<T, JsonNode> encoder,
            Function<JsonNode, T> decoder,
            Predicate<T> emptiness,
            BiPredicate<T, T> sameness
    ) implements FieldType<T> {

        @Override
        public JsonNode encode(T value, ObjectMapper mapper) {
            return value == null ? NODES.nullNode() : encoder.apply(value);
        }

        @Override
        public T decode(JsonNode node, ObjectMapper mapper) {
            return node == null || node.isNull() ? null : decoder.apply(node);
        }

        @Override
        public boolean isEmpty(T value) {
            return emptiness.test(value);
        }

        @Override
        public boolean sameValue(T a, T b) {
            return sameness.test(a, b);
        }
    }

    /**
     * Values bound through Jackson; sameness is record/list equality.
     */
    private record Structured<T>(
            String name,
            Class<?> rawType,
            TypeReference<T> typeRef,
            Predicate<T> emptiness
    ) implements FieldType<T> {

        @Override
        @SuppressWarnings("unchecked")
        public Class<T> javaType() {
            return (Class<T>) rawType;
        }

        @Override
        public JsonNode encode(T value, ObjectMapper mapper) {
            return value == null ? NODES.nullNode() : mapper.valueToTree(value);
        }

        @Override
        public T decode(JsonNode node, ObjectMapper mapper) {
            if (node == null || node.isNull()) {
                return null;
            }
            try {
                return mapper.convertValue(node, typeRef);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("not a " + name + " value: " + e.getMessage(), e);
            }
        }

        @Override
        public boolean isEmpty(T value) {
            return emptiness.test(value);
        }

        @Override
        public boolean sameValue(T a, T b) {
            return Objects.equals(a, b);
        }
    }
}
