package io.github.drompincen.polarionclient.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.polarionclient.client.model.LinkFields;
import io.github.drompincen.polarionclient.protocol.api.FieldSelector;
import io.github.drompincen.polarionclient.protocol.api.Page;
import io.github.drompincen.polarionclient.protocol.api.QueryOptions;
import io.github.drompincen.polarionclient.protocol.api.ResourceRef;
import io.github.drompincen.polarionclient.runtime.batch.Batch;
import io.github.drompincen.polarionclient.runtime.batch.BatchPartitioner;
import io.github.drompincen.polarionclient.runtime.batch.OversizedItem;
import io.github.drompincen.polarionclient.runtime.batch.PartitionResult;
import io.github.drompincen.polarionclient.runtime.codec.EncodeMode;
import io.github.drompincen.polarionclient.runtime.error.BatchSubmissionException;
import io.github.drompincen.polarionclient.runtime.error.OperationCancelledException;
import io.github.drompincen.polarionclient.runtime.error.OversizedItemException;
import io.github.drompincen.polarionclient.runtime.error.PolarionException;
import io.github.drompincen.polarionclient.runtime.error.ResponseDecodingException;
import io.github.drompincen.polarionclient.runtime.error.ValidationException;
import io.github.drompincen.polarionclient.runtime.resource.Resource;
import io.github.drompincen.polarionclient.runtime.retry.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Links between work items. Links are created, listed and deleted through the source work item;
 * a single link is addressed by its {@link WorkItemLinkId}.
 */
public class WorkItemLinkService extends AbstractResourceService {

    private static final Logger log = LoggerFactory.getLogger(WorkItemLinkService.class);

    private final String projectId;
    private final BatchPartitioner<Resource> partitioner;

    WorkItemLinkService(ApiClient api, String projectId) {
        super(api, LinkFields.SCHEMA);
        this.projectId = projectId;
        this.partitioner = new BatchPartitioner<>(item -> codec.encodedSize(item, EncodeMode.CREATE));
    }

    /**
     * @param targetWorkItemId short ids are taken to be in this project
     */
    public Resource newLink(String role, String targetWorkItemId, boolean suspect) {
        Resource link = new Resource(LinkFields.RESOURCE_TYPE)
                .set(LinkFields.ROLE, role)
                .set(LinkFields.SUSPECT, suspect);
        link.relationships().setSingle(LinkFields.WORK_ITEM, ResourceRef.workItem(fullId(targetWorkItemId)));
        return link;
    }

    public Resource get(String linkId) {
        return get(linkId, FieldSelector.ALL, CancellationToken.create());
    }

    public Resource get(String linkId, FieldSelector fields, CancellationToken token) {
        WorkItemLinkId id = WorkItemLinkId.parse(linkId);
        String operation = "get link " + linkId;
        JsonNode document = api.get(operation,
                api.uri(linkPath(id), (fields != null ? fields : FieldSelector.ALL).toQueryParams()), token);
        return readSingle(operation, document);
    }

    public Page<Resource> list(String workItemId, QueryOptions options, CancellationToken token) {
        JsonNode document = api.get("list links of " + workItemId,
                api.uri(linksPath(projectId, workItemId), api.pageParams(options, true)), token);
        return api.readPage(document, codec);
    }

    /** All outgoing links of the work item. */
    public List<Resource> list(String workItemId) {
        CancellationToken token = CancellationToken.create();
        return collectAll(QueryOptions.of(null), token, o -> list(workItemId, o, token));
    }

    // ---- create ----

    public List<Resource> create(String workItemId, List<Resource> links) {
        return create(workItemId, links, CancellationToken.create());
    }

    /**
     * Creates links from {@code workItemId}. The given resources receive the ids assigned by
     * the server and are returned in input order.
     */
    public List<Resource> create(String workItemId, List<Resource> links, CancellationToken token) {
        Objects.requireNonNull(links, "links");
        for (int i = 0; i < links.size(); i++) {
            validateForCreate(i, links.get(i));
        }
        if (links.isEmpty()) {
            return List.of();
        }
        ClientConfig config = api.config();
        PartitionResult<Resource> partition = partitioner.partition(links, config.batchSize(), config.maxContentSize());
        if (partition.hasSkipped()) {
            OversizedItem<Resource> first = partition.skipped().get(0);
            throw new OversizedItemException(first.index(), first.encodedSize(), config.maxContentSize());
        }
        List<Batch<Resource>> batches = partition.batches();
        for (int b = 0; b < batches.size(); b++) {
            Batch<Resource> batch = batches.get(b);
            try {
                submitBatch(workItemId, batch, token);
            } catch (OperationCancelledException e) {
                throw e;
            } catch (PolarionException e) {
                throw new BatchSubmissionException(b, batch.firstIndex(), e);
            }
        }
        log.debug("Created {} links from {} in {} requests", links.size(), workItemId, batches.size());
        return links;
    }

    private void submitBatch(String workItemId, Batch<Resource> batch, CancellationToken token) {
        List<ObjectNode> encoded = new ArrayList<>(batch.size());
        for (Resource link : batch.items()) {
            encoded.add(codec.encode(link, EncodeMode.CREATE));
        }
        JsonNode response = api.post("create links from " + workItemId, api.uri(linksPath(projectId, workItemId)),
                api.dataArrayDocument(encoded), token);
        JsonNode data = response.path("data");
        if (!data.isArray() || data.size() != batch.size()) {
            throw new ResponseDecodingException("create links: expected " + batch.size()
                    + " resources in response, got " + (data.isArray() ? data.size() : 0));
        }
        for (int i = 0; i < batch.size(); i++) {
            JsonNode returned = data.get(i);
            Resource link = batch.items().get(i);
            link.setId(returned.path("id").asText(null));
            if (returned.has("links")) {
                link.setLinks(returned.get("links").deepCopy());
            }
        }
    }

    private static void validateForCreate(int index, Resource link) {
        if (link == null) {
            throw new ValidationException("links[" + index + "]", "must not be null");
        }
        if (!LinkFields.RESOURCE_TYPE.equals(link.getType())) {
            throw new ValidationException("links[" + index + "].type",
                    "expected " + LinkFields.RESOURCE_TYPE + " but was " + link.getType());
        }
        String role = link.get(LinkFields.ROLE).orElse("");
        if (role.isEmpty()) {
            throw new ValidationException("links[" + index + "].role", "role is required");
        }
        if (link.relationships().refs(LinkFields.WORK_ITEM).isEmpty()) {
            throw new ValidationException("links[" + index + "].workItem", "target work item is required");
        }
    }

    // ---- update ----

    /** Sends the suspect flag and pinned revision; role and target are part of the id and cannot change. */
    public void update(Resource link) {
        update(link, CancellationToken.create());
    }

    public void update(Resource link, CancellationToken token) {
        Objects.requireNonNull(link, "link");
        if (link.isNew()) {
            throw new ValidationException("link.id", "an id is required for update");
        }
        WorkItemLinkId id = WorkItemLinkId.parse(link.getId());
        Resource patch = new Resource(LinkFields.RESOURCE_TYPE);
        patch.setId(id.toString());
        link.get(LinkFields.SUSPECT).ifPresent(v -> patch.set(LinkFields.SUSPECT, v));
        link.get(LinkFields.REVISION).ifPresent(v -> patch.set(LinkFields.REVISION, v));
        api.patch("update link " + id, api.uri(linkPath(id)),
                api.dataDocument(codec.encode(patch, EncodeMode.UPDATE)), token);
    }

    // ---- delete ----

    public void delete(String... linkIds) {
        delete(List.of(linkIds), CancellationToken.create());
    }

    /** Issues one request per source work item. */
    public void delete(List<String> linkIds, CancellationToken token) {
        Map<String, List<WorkItemLinkId>> bySource = new LinkedHashMap<>();
        for (String linkId : linkIds) {
            WorkItemLinkId id = WorkItemLinkId.parse(linkId);
            bySource.computeIfAbsent(id.sourceId(), k -> new ArrayList<>()).add(id);
        }
        for (List<WorkItemLinkId> group : bySource.values()) {
            token.throwIfCancelled();
            WorkItemLinkId first = group.get(0);
            List<ObjectNode> refs = new ArrayList<>(group.size());
            for (WorkItemLinkId id : group) {
                ObjectNode ref = api.mapper().createObjectNode();
                ref.put("type", LinkFields.RESOURCE_TYPE);
                ref.put("id", id.toString());
                refs.add(ref);
            }
            api.delete("delete links from " + first.sourceId(),
                    api.uri(linksPath(first.projectId(), first.workItemId())), api.dataArrayDocument(refs), token);
        }
    }

    // ---- ids ----

    private String fullId(String workItemId) {
        return workItemId.contains("/") ? workItemId : projectId + "/" + workItemId;
    }

    private static String linksPath(String project, String workItemId) {
        return ApiClient.path("projects", project, "workitems", Resource.shortId(workItemId), "linkedworkitems");
    }

    private static String linkPath(WorkItemLinkId id) {
        return ApiClient.path("projects", id.projectId(), "workitems", id.workItemId(), "linkedworkitems",
                id.role(), id.targetProjectId(), id.targetWorkItemId());
    }
}
