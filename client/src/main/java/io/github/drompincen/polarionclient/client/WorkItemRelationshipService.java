package io.github.drompincen.polarionclient.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.polarionclient.client.model.WorkItemFields;
import io.github.drompincen.polarionclient.protocol.api.ResourceRef;
import io.github.drompincen.polarionclient.runtime.codec.EncodeMode;
import io.github.drompincen.polarionclient.runtime.error.ResponseDecodingException;
import io.github.drompincen.polarionclient.runtime.error.ValidationException;
import io.github.drompincen.polarionclient.runtime.resource.Relationship;
import io.github.drompincen.polarionclient.runtime.resource.RelationshipSet;
import io.github.drompincen.polarionclient.runtime.resource.Resource;
import io.github.drompincen.polarionclient.runtime.retry.CancellationToken;

import java.util.List;
import java.util.Objects;

/**
 * Reads and edits a single relationship of a work item without touching the rest of it.
 * Relationship names outside the work item schema are passed through as they are.
 */
public class WorkItemRelationshipService extends AbstractResourceService {

    private final String projectId;

    WorkItemRelationshipService(ApiClient api, String projectId) {
        super(api, WorkItemFields.SCHEMA);
        this.projectId = projectId;
    }

    public Relationship get(String workItemId, String relationship) {
        return get(workItemId, relationship, CancellationToken.create());
    }

    public Relationship get(String workItemId, String relationship, CancellationToken token) {
        String operation = "get " + relationship + " of " + workItemId;
        JsonNode document = api.get(operation, api.uri(relationshipPath(workItemId, relationship)), token);
        if (!document.isObject()) {
            throw new ResponseDecodingException(operation + ": response has no relationship object");
        }
        ObjectNode wrapper = api.mapper().createObjectNode();
        wrapper.set(relationship, document);
        return codec.decodeRelationships(wrapper).get(relationship)
                .orElseThrow(() -> new ResponseDecodingException(operation + ": empty response"));
    }

    /** Adds targets to a to-many relationship. An empty list makes no request. */
    public void add(String workItemId, String relationship, List<ResourceRef> targets) {
        add(workItemId, relationship, targets, CancellationToken.create());
    }

    public void add(String workItemId, String relationship, List<ResourceRef> targets, CancellationToken token) {
        Objects.requireNonNull(targets, "targets");
        if (targets.isEmpty()) {
            return;
        }
        api.post("add to " + relationship + " of " + workItemId, api.uri(relationshipPath(workItemId, relationship)),
                encode(relationship, Relationship.list(targets)), token);
    }

    /** Replaces the whole relationship; {@link Relationship#none()} empties a to-one relationship. */
    public void replace(String workItemId, String relationship, Relationship value) {
        replace(workItemId, relationship, value, CancellationToken.create());
    }

    public void replace(String workItemId, String relationship, Relationship value, CancellationToken token) {
        Objects.requireNonNull(value, "value");
        if (!value.hasData()) {
            throw new ValidationException(relationship, "replacement must carry data");
        }
        api.patch("replace " + relationship + " of " + workItemId, api.uri(relationshipPath(workItemId, relationship)),
                encode(relationship, value), token);
    }

    /**
     * Removes the given targets, or the whole relationship content when {@code targets} is empty.
     */
    public void remove(String workItemId, String relationship, List<ResourceRef> targets) {
        remove(workItemId, relationship, targets, CancellationToken.create());
    }

    public void remove(String workItemId, String relationship, List<ResourceRef> targets, CancellationToken token) {
        Objects.requireNonNull(targets, "targets");
        JsonNode body = targets.isEmpty() ? null : encode(relationship, Relationship.list(targets));
        api.delete("remove from " + relationship + " of " + workItemId,
                api.uri(relationshipPath(workItemId, relationship)), body, token);
    }

    private ObjectNode encode(String relationship, Relationship value) {
        RelationshipSet set = new RelationshipSet();
        if (WorkItemFields.SCHEMA.isKnownRelationship(relationship)) {
            set.set(relationship, value);
        } else {
            set.setDynamic(relationship, value);
        }
        return (ObjectNode) codec.encodeRelationships(set, EncodeMode.UPDATE).get(relationship);
    }

    private String relationshipPath(String workItemId, String relationship) {
        if (relationship == null || relationship.isEmpty()) {
            throw new ValidationException("relationship", "must not be empty");
        }
        return ApiClient.path("projects", projectId, "workitems", Resource.shortId(workItemId),
                "relationships", relationship);
    }
}
