package io.github.drompincen.polarionclient.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.polarionclient.client.model.CommentFields;
import io.github.drompincen.polarionclient.protocol.api.Page;
import io.github.drompincen.polarionclient.protocol.api.QueryOptions;
import io.github.drompincen.polarionclient.protocol.api.ResourceRef;
import io.github.drompincen.polarionclient.protocol.api.TextContent;
import io.github.drompincen.polarionclient.runtime.codec.EncodeMode;
import io.github.drompincen.polarionclient.runtime.error.ValidationException;
import io.github.drompincen.polarionclient.runtime.resource.Resource;
import io.github.drompincen.polarionclient.runtime.retry.CancellationToken;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Comments on work items of one project. Replies point at their parent through the
 * {@code parentComment} relationship.
 */
public class WorkItemCommentService extends AbstractResourceService {

    private final String projectId;

    WorkItemCommentService(ApiClient api, String projectId) {
        super(api, CommentFields.SCHEMA);
        this.projectId = projectId;
    }

    public Resource newComment(TextContent text) {
        return new Resource(CommentFields.RESOURCE_TYPE).set(CommentFields.TEXT, text);
    }

    public Resource newReply(String parentCommentId, TextContent text) {
        Resource reply = newComment(text);
        reply.relationships().setSingle(CommentFields.PARENT_COMMENT,
                ResourceRef.of(CommentFields.RESOURCE_TYPE, parentCommentId));
        return reply;
    }

    public Resource get(String workItemId, String commentId) {
        return get(workItemId, commentId, null, CancellationToken.create());
    }

    public Resource get(String workItemId, String commentId, String revision, CancellationToken token) {
        requireText(commentId, "commentId");
        Map<String, String> params = new LinkedHashMap<>();
        if (revision != null && !revision.isEmpty()) {
            params.put("revision", revision);
        }
        String operation = "get comment " + commentId + " of " + workItemId;
        JsonNode document = api.get(operation, api.uri(commentPath(workItemId, commentId), params), token);
        return readSingle(operation, document);
    }

    public Page<Resource> list(String workItemId, QueryOptions options, CancellationToken token) {
        JsonNode document = api.get("list comments of " + workItemId,
                api.uri(commentsPath(workItemId), api.pageParams(options, false)), token);
        return api.readPage(document, codec);
    }

    public List<Resource> list(String workItemId) {
        CancellationToken token = CancellationToken.create();
        return collectAll(QueryOptions.of(null), token, o -> list(workItemId, o, token));
    }

    public List<Resource> create(String workItemId, List<Resource> comments) {
        return create(workItemId, comments, CancellationToken.create());
    }

    /** Posts all comments in one request and returns the created records. */
    public List<Resource> create(String workItemId, List<Resource> comments, CancellationToken token) {
        Objects.requireNonNull(comments, "comments");
        if (comments.isEmpty()) {
            throw new ValidationException("comments", "at least one comment is required");
        }
        List<ObjectNode> encoded = new ArrayList<>(comments.size());
        for (int i = 0; i < comments.size(); i++) {
            Resource comment = comments.get(i);
            if (comment == null || !CommentFields.RESOURCE_TYPE.equals(comment.getType())) {
                throw new ValidationException("comments[" + i + "]", "expected a " + CommentFields.RESOURCE_TYPE + " resource");
            }
            if (!comment.attributes().has(CommentFields.TEXT)) {
                throw new ValidationException("comments[" + i + "].text", "text is required");
            }
            encoded.add(codec.encode(comment, EncodeMode.CREATE));
        }
        JsonNode response = api.post("create comments on " + workItemId, api.uri(commentsPath(workItemId)),
                api.dataArrayDocument(encoded), token);
        return codec.decodeAll(response.path("data"));
    }

    public void update(String workItemId, Resource comment) {
        update(workItemId, comment, CancellationToken.create());
    }

    /** Sends the writable attributes, typically the text or the resolved flag. */
    public void update(String workItemId, Resource comment, CancellationToken token) {
        Objects.requireNonNull(comment, "comment");
        if (comment.isNew()) {
            throw new ValidationException("comment.id", "an id is required for update");
        }
        Resource patch = new Resource(CommentFields.RESOURCE_TYPE, comment.getId(), null,
                comment.attributes().copy(), null, null, null);
        api.patch("update comment " + comment.getId(), api.uri(commentPath(workItemId, comment.getId())),
                api.dataDocument(codec.encode(patch, EncodeMode.UPDATE)), token);
    }

    private String commentsPath(String workItemId) {
        requireText(workItemId, "workItemId");
        return ApiClient.path("projects", projectId, "workitems", Resource.shortId(workItemId), "comments");
    }

    private String commentPath(String workItemId, String commentId) {
        return commentsPath(workItemId) + "/" + ApiClient.escape(Resource.shortId(commentId));
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isEmpty()) {
            throw new ValidationException(name, "must not be empty");
        }
    }
}
