package io.github.drompincen.polarionclient.client;

/**
 * Services scoped to one project.
 */
public class ProjectClient {

    private final String projectId;
    private final WorkItemService workItems;
    private final EnumerationService enumerations;
    private final WorkItemApprovalService approvals;
    private final WorkItemAttachmentService attachments;
    private final WorkItemLinkService links;
    private final WorkItemCommentService comments;
    private final WorkItemRelationshipService relationships;

    ProjectClient(ApiClient api, String projectId) {
        this.projectId = projectId;
        this.workItems = new WorkItemService(api, projectId);
        this.enumerations = new EnumerationService(api, projectId);
        this.approvals = new WorkItemApprovalService(api, projectId);
        this.attachments = new WorkItemAttachmentService(api, projectId);
        this.links = new WorkItemLinkService(api, projectId);
        this.comments = new WorkItemCommentService(api, projectId);
        this.relationships = new WorkItemRelationshipService(api, projectId);
    }

    public String projectId() { return projectId; }

    public WorkItemService workItems() { return workItems; }

    public EnumerationService enumerations() { return enumerations; }

    public WorkItemApprovalService approvals() { return approvals; }

    public WorkItemAttachmentService attachments() { return attachments; }

    public WorkItemLinkService links() { return links; }

    public WorkItemCommentService comments() { return comments; }

    public WorkItemRelationshipService relationships() { return relationships; }
}
