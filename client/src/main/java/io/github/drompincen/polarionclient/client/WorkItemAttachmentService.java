package io.github.drompincen.polarionclient.client;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.polarionclient.client.model.AttachmentFields;
import io.github.drompincen.polarionclient.protocol.api.FieldSelector;
import io.github.drompincen.polarionclient.runtime.resource.Resource;
import io.github.drompincen.polarionclient.runtime.retry.CancellationToken;

import java.util.List;
import java.util.Map;

/**
 * Attachment metadata and content of work items in one project. Uploading is not supported.
 */
public class WorkItemAttachmentService extends AbstractResourceService {

    private final String projectId;

    WorkItemAttachmentService(ApiClient api, String projectId) {
        super(api, AttachmentFields.SCHEMA);
        this.projectId = projectId;
    }

    public List<Resource> list(String workItemId) {
        JsonNode document = api.get("list attachments of " + workItemId,
                api.uri(attachmentsPath(workItemId), selectAll()), CancellationToken.create());
        return codec.decodeAll(document.path("data"));
    }

    public Resource get(String workItemId, String attachmentId) {
        String operation = "get attachment " + attachmentId + " of " + workItemId;
        JsonNode document = api.get(operation, api.uri(attachmentPath(workItemId, attachmentId), selectAll()),
                CancellationToken.create());
        return readSingle(operation, document);
    }

    public byte[] download(String workItemId, String attachmentId) {
        return download(workItemId, attachmentId, CancellationToken.create());
    }

    public byte[] download(String workItemId, String attachmentId, CancellationToken token) {
        return api.download("download attachment " + attachmentId + " of " + workItemId,
                api.uri(attachmentPath(workItemId, attachmentId) + "/content"), token);
    }

    public void delete(String workItemId, String attachmentId) {
        api.delete("delete attachment " + attachmentId + " of " + workItemId,
                api.uri(attachmentPath(workItemId, attachmentId)), null, CancellationToken.create());
    }

    private static Map<String, String> selectAll() {
        return Map.of("fields[workitem_attachments]", FieldSelector.ALL.workItemAttachments());
    }

    private String attachmentsPath(String workItemId) {
        return ApiClient.path("projects", projectId, "workitems", Resource.shortId(workItemId), "attachments");
    }

    private String attachmentPath(String workItemId, String attachmentId) {
        return attachmentsPath(workItemId) + "/" + ApiClient.escape(Resource.shortId(attachmentId));
    }
}
