package io.github.drompincen.polarionclient.runtime.diff;

import io.github.drompincen.polarionclient.runtime.resource.AttributeSet;
import io.github.drompincen.polarionclient.runtime.resource.RelationshipSet;
import io.github.drompincen.polarionclient.runtime.resource.Resource;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Fields that differ between a baseline and a modified resource. Never empty: the diff engine
 * returns {@code Optional.empty()} instead.
 */
public record ChangeSet(AttributeSet attributes, RelationshipSet relationships) {

    public Set<String> changedAttributes() {
        Set<String> names = new LinkedHashSet<>(attributes.knownNames());
        names.addAll(attributes.dynamicEntries().keySet());
        names.addAll(attributes.clearedNames());
        return names;
    }

    public Set<String> changedRelationships() {
        Set<String> names = new LinkedHashSet<>(relationships.knownEntries().keySet());
        names.addAll(relationships.dynamicEntries().keySet());
        names.addAll(relationships.clearedNames());
        return names;
    }

    /** Patch document for the given resource identity. */
    public Resource toResource(String type, String id) {
        return new Resource(type, id, null, attributes.copy(), relationships.copy(), null, null);
    }

    boolean isEmpty() {
        return attributes.isEmpty() && relationships.isEmpty();
    }
}
