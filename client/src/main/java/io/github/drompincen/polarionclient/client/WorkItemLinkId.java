package io.github.drompincen.polarionclient.client;

import io.github.drompincen.polarionclient.runtime.error.ValidationException;

/**
 * Identity of a work item link, written on the wire as
 * {@code project/workItem/role/targetProject/targetWorkItem}.
 */
public record WorkItemLinkId(
        String projectId,
        String workItemId,
        String role,
        String targetProjectId,
        String targetWorkItemId
) {

    public static WorkItemLinkId parse(String linkId) {
        if (linkId == null) {
            throw new ValidationException("linkId", "must not be null");
        }
        String[] parts = linkId.split("/", -1);
        if (parts.length != 5) {
            throw new ValidationException("linkId", "expected project/workItem/role/targetProject/targetWorkItem but was " + linkId);
        }
        for (String part : parts) {
            if (part.isEmpty()) {
                throw new ValidationException("linkId", "empty segment in " + linkId);
            }
        }
        return new WorkItemLinkId(parts[0], parts[1], parts[2], parts[3], parts[4]);
    }

    /** Full id of the work item the link belongs to. */
    public String sourceId() {
        return projectId + "/" + workItemId;
    }

    public String targetId() {
        return targetProjectId + "/" + targetWorkItemId;
    }

    @Override
    public String toString() {
        return sourceId() + "/" + role + "/" + targetId();
    }
}
