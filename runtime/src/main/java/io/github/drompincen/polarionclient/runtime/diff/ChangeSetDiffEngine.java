package io.github.drompincen.polarionclient.runtime.diff;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.polarionclient.runtime.resource.AttributeSet;
import io.github.drompincen.polarionclient.runtime.resource.Relationship;
import io.github.drompincen.polarionclient.runtime.resource.RelationshipSet;
import io.github.drompincen.polarionclient.runtime.resource.Resource;
import io.github.drompincen.polarionclient.runtime.schema.FieldDefinition;
import io.github.drompincen.polarionclient.runtime.schema.ResourceSchema;

import java.util.Comparator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Computes the minimal set of writable fields to send so that the server copy of
 * {@code baseline} becomes {@code modified}.
 *
 * <p>An empty known value in {@code modified} means "not touched", not "clear it". To clear a
 * field, mark it with {@link AttributeSet#clear} or {@link RelationshipSet#clear}; the marker
 * produces a change only when the baseline had a value. Read-only fields never appear.
 */
public final class ChangeSetDiffEngine {

    /** Numbers compare by value so {@code 5} and {@code 5.0} are equal. */
    private static final Comparator<JsonNode> JSON_VALUE_COMPARATOR = (a, b) -> {
        if (a.isNumber() && b.isNumber()) {
            if (!isFinite(a) || !isFinite(b)) {
                return Double.compare(a.doubleValue(), b.doubleValue());
            }
            return a.decimalValue().compareTo(b.decimalValue());
        }
        return a.equals(b) ? 0 : 1;
    };

    private final ResourceSchema schema;

    public ChangeSetDiffEngine(ResourceSchema schema) {
        this.schema = Objects.requireNonNull(schema, "schema");
    }

    /**
     * @param baseline server state; null means the resource does not exist yet
     * @return empty when nothing writable changed
     */
    public Optional<ChangeSet> diff(Resource baseline, Resource modified) {
        Objects.requireNonNull(modified, "modified");
        Resource base = baseline != null ? baseline : new Resource(modified.getType());
        AttributeSet attributes = diffAttributes(base.attributes(), modified.attributes());
        RelationshipSet relationships = diffRelationships(base.relationships(), modified.relationships());
        ChangeSet changes = new ChangeSet(attributes, relationships);
        return changes.isEmpty() ? Optional.empty() : Optional.of(changes);
    }

    public boolean equals(Resource a, Resource b) {
        return diff(a, b).isEmpty();
    }

    private AttributeSet diffAttributes(AttributeSet base, AttributeSet modified) {
        AttributeSet out = new AttributeSet();
        for (FieldDefinition<?> definition : schema.fields()) {
            if (!definition.readOnly()) {
                diffKnown(definition, base, modified, out);
            }
        }
        for (Map.Entry<String, JsonNode> entry : modified.dynamicEntries().entrySet()) {
            Optional<JsonNode> before = base.getDynamic(entry.getKey());
            if (before.isEmpty() || !sameJson(before.get(), entry.getValue())) {
                out.setDynamic(entry.getKey(), entry.getValue().deepCopy());
            }
        }
        for (String name : modified.clearedNames()) {
            if (!schema.isKnownAttribute(name)
                    && base.getDynamic(name).filter(n -> !n.isNull()).isPresent()) {
                out.clearDynamic(name);
            }
        }
        return out;
    }

    private <T> void diffKnown(FieldDefinition<T> definition, AttributeSet base, AttributeSet modified, AttributeSet out) {
        T before = base.getOrNull(definition);
        if (modified.isCleared(definition.name())) {
            if (before != null) {
                out.clear(definition);
            }
            return;
        }
        T after = modified.getOrNull(definition);
        if (definition.type().isEmpty(after)) {
            return;
        }
        if (!definition.type().sameValue(before, after)) {
            out.set(definition, after);
        }
    }

    private RelationshipSet diffRelationships(RelationshipSet base, RelationshipSet modified) {
        RelationshipSet out = new RelationshipSet();
        for (Map.Entry<String, Relationship> entry : modified.knownEntries().entrySet()) {
            if (changed(base, entry.getKey(), entry.getValue())) {
                out.set(entry.getKey(), dataOnly(entry.getValue()));
            }
        }
        for (Map.Entry<String, Relationship> entry : modified.dynamicEntries().entrySet()) {
            if (changed(base, entry.getKey(), entry.getValue())) {
                out.setDynamic(entry.getKey(), dataOnly(entry.getValue()));
            }
        }
        for (String name : modified.clearedNames()) {
            if (!base.refs(name).isEmpty()) {
                out.clear(name);
            }
        }
        return out;
    }

    private static boolean changed(RelationshipSet base, String name, Relationship after) {
        if (!after.hasData() || after.isEmpty()) {
            return false;
        }
        return base.get(name).map(before -> !before.sameRefs(after)).orElse(true);
    }

    private static Relationship dataOnly(Relationship relationship) {
        return new Relationship(relationship.shape(), relationship.refs(), null, null);
    }

    private static boolean isFinite(JsonNode number) {
        return !(number.isDouble() || number.isFloat()) || Double.isFinite(number.doubleValue());
    }

    static boolean sameJson(JsonNode a, JsonNode b) {
        return a.equals(JSON_VALUE_COMPARATOR, b);
    }
}
