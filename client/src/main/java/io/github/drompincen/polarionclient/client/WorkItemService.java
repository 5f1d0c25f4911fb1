package io.github.drompincen.polarionclient.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.polarionclient.client.model.WorkItemFields;
import io.github.drompincen.polarionclient.protocol.api.FieldSelector;
import io.github.drompincen.polarionclient.protocol.api.Page;
import io.github.drompincen.polarionclient.protocol.api.QueryOptions;
import io.github.drompincen.polarionclient.runtime.batch.Batch;
import io.github.drompincen.polarionclient.runtime.batch.BatchPartitioner;
import io.github.drompincen.polarionclient.runtime.batch.OversizedItem;
import io.github.drompincen.polarionclient.runtime.batch.PartitionResult;
import io.github.drompincen.polarionclient.runtime.codec.EncodeMode;
import io.github.drompincen.polarionclient.runtime.diff.ChangeSet;
import io.github.drompincen.polarionclient.runtime.diff.ChangeSetDiffEngine;
import io.github.drompincen.polarionclient.runtime.error.BatchSubmissionException;
import io.github.drompincen.polarionclient.runtime.error.OperationCancelledException;
import io.github.drompincen.polarionclient.runtime.error.OversizedItemException;
import io.github.drompincen.polarionclient.runtime.error.PolarionException;
import io.github.drompincen.polarionclient.runtime.error.ResponseDecodingException;
import io.github.drompincen.polarionclient.runtime.error.ValidationException;
import io.github.drompincen.polarionclient.runtime.resource.CustomFields;
import io.github.drompincen.polarionclient.runtime.resource.Resource;
import io.github.drompincen.polarionclient.runtime.retry.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Work items of one project.
 *
 * <p>Create splits the input into requests bounded by the configured batch size and max
 * content size. Update comes in two flavors: {@link #update(Resource)} sends every writable
 * field, {@link #update(Resource, Resource)} sends only what changed against a baseline.
 */
public class WorkItemService extends AbstractResourceService {

    private static final Logger log = LoggerFactory.getLogger(WorkItemService.class);

    private final String projectId;
    private final ChangeSetDiffEngine diffEngine;
    private final BatchPartitioner<Resource> partitioner;

    WorkItemService(ApiClient api, String projectId) {
        super(api, WorkItemFields.SCHEMA);
        this.projectId = projectId;
        this.diffEngine = new ChangeSetDiffEngine(WorkItemFields.SCHEMA);
        this.partitioner = new BatchPartitioner<>(item -> codec.encodedSize(item, EncodeMode.CREATE));
    }

    public String projectId() {
        return projectId;
    }

    public Resource newWorkItem(String type, String title) {
        return new Resource(WorkItemFields.RESOURCE_TYPE)
                .set(WorkItemFields.TYPE, type)
                .set(WorkItemFields.TITLE, title);
    }

    public CustomFields customFields(Resource workItem) {
        return new CustomFields(workItem.attributes(), api.mapper());
    }

    // ---- read ----

    public Resource get(String workItemId) {
        return get(workItemId, FieldSelector.ALL, null, CancellationToken.create());
    }

    public Resource get(String workItemId, FieldSelector fields, String revision, CancellationToken token) {
        Map<String, String> params = new LinkedHashMap<>((fields != null ? fields : FieldSelector.ALL).toQueryParams());
        if (revision != null && !revision.isEmpty()) {
            params.put("revision", revision);
        }
        String operation = "get work item " + workItemId;
        JsonNode document = api.get(operation, api.uri(itemPath(workItemId), params), token);
        return readSingle(operation, document);
    }

    public Page<Resource> query(QueryOptions options) {
        return query(options, CancellationToken.create());
    }

    public Page<Resource> query(QueryOptions options, CancellationToken token) {
        JsonNode document = api.get("query work items", api.uri(collectionPath(), api.pageParams(options, true)), token);
        return api.readPage(document, codec);
    }

    public List<Resource> queryAll(QueryOptions options) {
        return queryAll(options, CancellationToken.create());
    }

    public List<Resource> queryAll(QueryOptions options, CancellationToken token) {
        List<Resource> all = collectAll(options, token, o -> query(o, token));
        log.debug("Fetched {} work items from project {}", all.size(), projectId);
        return all;
    }

    // ---- create ----

    public CreateResult create(List<Resource> workItems) {
        return create(workItems, CancellationToken.create());
    }

    public CreateResult create(List<Resource> workItems, CancellationToken token) {
        Objects.requireNonNull(workItems, "workItems");
        for (int i = 0; i < workItems.size(); i++) {
            validateForCreate(i, workItems.get(i));
        }
        if (workItems.isEmpty()) {
            return new CreateResult(List.of(), List.of(), 0);
        }
        ClientConfig config = api.config();
        PartitionResult<Resource> partition = partitioner.partition(workItems, config.batchSize(), config.maxContentSize());
        if (partition.hasSkipped()) {
            if (config.oversizedItemPolicy() == OversizedItemPolicy.FAIL) {
                OversizedItem<Resource> first = partition.skipped().get(0);
                throw new OversizedItemException(first.index(), first.encodedSize(), config.maxContentSize());
            }
            for (OversizedItem<Resource> skipped : partition.skipped()) {
                log.warn("Skipping work item #{} ({} bytes), larger than the {} byte request limit",
                        skipped.index(), skipped.encodedSize(), config.maxContentSize());
            }
        }

        List<Resource> created = new ArrayList<>(partition.itemCount());
        List<Batch<Resource>> batches = partition.batches();
        for (int b = 0; b < batches.size(); b++) {
            Batch<Resource> batch = batches.get(b);
            log.debug("Creating batch {}/{}: {} work items, {} bytes", b + 1, batches.size(),
                    batch.size(), batch.encodedSize());
            try {
                submitBatch(batch, token);
            } catch (OperationCancelledException e) {
                throw e;
            } catch (PolarionException e) {
                throw new BatchSubmissionException(b, batch.firstIndex(), e);
            }
            created.addAll(batch.items());
        }
        return new CreateResult(created, partition.skipped(), batches.size());
    }

    private void submitBatch(Batch<Resource> batch, CancellationToken token) {
        List<ObjectNode> encoded = new ArrayList<>(batch.size());
        for (Resource item : batch.items()) {
            encoded.add(codec.encode(item, EncodeMode.CREATE));
        }
        JsonNode response = api.post("create work items", api.uri(collectionPath()),
                api.dataArrayDocument(encoded), token);
        JsonNode data = response.path("data");
        if (!data.isArray() || data.size() != batch.size()) {
            throw new ResponseDecodingException("create work items: expected " + batch.size()
                    + " resources in response, got " + (data.isArray() ? data.size() : 0));
        }
        for (int i = 0; i < batch.size(); i++) {
            JsonNode returned = data.get(i);
            Resource item = batch.items().get(i);
            item.setId(returned.path("id").asText(null));
            if (returned.hasNonNull("revision")) {
                item.setRevision(returned.get("revision").asText());
            }
            if (returned.has("links")) {
                item.setLinks(returned.get("links").deepCopy());
            }
        }
    }

    private void validateForCreate(int index, Resource item) {
        if (item == null) {
            throw new ValidationException("workItems[" + index + "]", "must not be null");
        }
        if (!WorkItemFields.RESOURCE_TYPE.equals(item.getType())) {
            throw new ValidationException("workItems[" + index + "].type",
                    "expected " + WorkItemFields.RESOURCE_TYPE + " but was " + item.getType());
        }
        if (!item.attributes().has(WorkItemFields.TITLE)) {
            throw new ValidationException("workItems[" + index + "].title", "title is required");
        }
    }

    // ---- update ----

    /** Sends all writable fields of {@code workItem}. */
    public void update(Resource workItem) {
        update(workItem, CancellationToken.create());
    }

    public void update(Resource workItem, CancellationToken token) {
        requireId(workItem, "workItem");
        patch(workItem, workItem, token);
    }

    /**
     * Sends only the fields of {@code modified} that differ from {@code baseline}.
     *
     * @return false when nothing changed and no request was made
     */
    public boolean update(Resource baseline, Resource modified) {
        return update(baseline, modified, CancellationToken.create());
    }

    public boolean update(Resource baseline, Resource modified, CancellationToken token) {
        Objects.requireNonNull(modified, "modified");
        if (modified.isNew() && baseline != null && !baseline.isNew()) {
            modified.setId(baseline.getId());
        }
        requireId(modified, "modified");
        Optional<ChangeSet> changes = diffEngine.diff(baseline, modified);
        if (changes.isEmpty()) {
            log.debug("Work item {} unchanged, skipping update", modified.getId());
            return false;
        }
        log.debug("Updating work item {}: attributes {}, relationships {}", modified.getId(),
                changes.get().changedAttributes(), changes.get().changedRelationships());
        Resource patch = changes.get().toResource(WorkItemFields.RESOURCE_TYPE, modified.getId());
        patch(patch, modified, token);
        return true;
    }

    private void patch(Resource body, Resource target, CancellationToken token) {
        ObjectNode data = codec.encode(body, EncodeMode.UPDATE);
        data.put("id", fullId(target.getId()));
        String operation = "update work item " + target.getId();
        JsonNode response = api.patch(operation, api.uri(itemPath(target.getId())), api.dataDocument(data), token);
        JsonNode returned = response.path("data");
        if (returned.hasNonNull("revision")) {
            target.setRevision(returned.get("revision").asText());
        }
    }

    public Optional<ChangeSet> diff(Resource baseline, Resource modified) {
        return diffEngine.diff(baseline, modified);
    }

    public boolean equals(Resource a, Resource b) {
        return diffEngine.equals(a, b);
    }

    // ---- delete ----

    public void delete(String... workItemIds) {
        delete(List.of(workItemIds), CancellationToken.create());
    }

    public void delete(List<String> workItemIds, CancellationToken token) {
        for (String id : workItemIds) {
            token.throwIfCancelled();
            api.delete("delete work item " + id, api.uri(itemPath(id)), null, token);
        }
        log.debug("Deleted {} work items from project {}", workItemIds.size(), projectId);
    }

    // ---- ids ----

    String fullId(String id) {
        return id.contains("/") ? id : projectId + "/" + id;
    }

    private String collectionPath() {
        return ApiClient.path("projects", projectId, "workitems");
    }

    private String itemPath(String id) {
        return ApiClient.path("projects", projectId, "workitems", Resource.shortId(id));
    }

    private static void requireId(Resource resource, String name) {
        Objects.requireNonNull(resource, name);
        if (resource.isNew()) {
            throw new ValidationException(name + ".id", "an id is required for update");
        }
    }
}
