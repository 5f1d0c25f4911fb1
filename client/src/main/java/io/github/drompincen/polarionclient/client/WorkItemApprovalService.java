package io.github.drompincen.polarionclient.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.polarionclient.client.model.ApprovalFields;
import io.github.drompincen.polarionclient.protocol.api.ApprovalStatus;
import io.github.drompincen.polarionclient.protocol.api.ResourceRef;
import io.github.drompincen.polarionclient.runtime.codec.EncodeMode;
import io.github.drompincen.polarionclient.runtime.resource.Resource;
import io.github.drompincen.polarionclient.runtime.retry.CancellationToken;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Approvals of work items in one project. An approval is identified by its work item and the
 * approving user.
 */
public class WorkItemApprovalService extends AbstractResourceService {

    private final String projectId;

    WorkItemApprovalService(ApiClient api, String projectId) {
        super(api, ApprovalFields.SCHEMA);
        this.projectId = projectId;
    }

    public List<Resource> list(String workItemId) {
        JsonNode document = api.get("list approvals of " + workItemId, api.uri(approvalsPath(workItemId)),
                CancellationToken.create());
        return codec.decodeAll(document.path("data"));
    }

    /** Requests approvals from the given users; returns the created records. */
    public List<Resource> add(String workItemId, ApprovalStatus status, String comment, String... userIds) {
        Objects.requireNonNull(status, "status");
        List<ObjectNode> encoded = new ArrayList<>();
        for (String userId : userIds) {
            Resource approval = new Resource(ApprovalFields.RESOURCE_TYPE)
                    .set(ApprovalFields.STATUS, status.wireValue())
                    .set(ApprovalFields.COMMENT, comment);
            approval.relationships().setSingle(ApprovalFields.USER, ResourceRef.user(userId));
            encoded.add(codec.encode(approval, EncodeMode.CREATE));
        }
        JsonNode response = api.post("add approvals to " + workItemId, api.uri(approvalsPath(workItemId)),
                api.dataArrayDocument(encoded), CancellationToken.create());
        JsonNode data = response.path("data");
        return data.isArray() ? codec.decodeAll(data) : List.of();
    }

    public void updateStatus(String workItemId, String userId, ApprovalStatus status, String comment) {
        Objects.requireNonNull(status, "status");
        Resource approval = new Resource(ApprovalFields.RESOURCE_TYPE)
                .set(ApprovalFields.STATUS, status.wireValue())
                .set(ApprovalFields.COMMENT, comment);
        approval.setId(approvalId(workItemId, userId));
        api.patch("update approval of " + userId + " on " + workItemId,
                api.uri(approvalsPath(workItemId) + "/" + ApiClient.escape(userId)),
                api.dataDocument(codec.encode(approval, EncodeMode.UPDATE)), CancellationToken.create());
    }

    public void delete(String workItemId, String... userIds) {
        for (String userId : userIds) {
            api.delete("delete approval of " + userId + " on " + workItemId,
                    api.uri(approvalsPath(workItemId) + "/" + ApiClient.escape(userId)), null,
                    CancellationToken.create());
        }
    }

    String approvalId(String workItemId, String userId) {
        return projectId + "/" + Resource.shortId(workItemId) + "/" + userId;
    }

    private String approvalsPath(String workItemId) {
        return ApiClient.path("projects", projectId, "workitems", Resource.shortId(workItemId), "approvals");
    }
}
