package io.github.drompincen.polarionclient.protocol.api;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sparse field selection. Each non-null member becomes a {@code fields[...]} query parameter.
 * Values are {@code @basic}, {@code @all} or a comma separated list of field names.
 */
public record FieldSelector(
        String workItems,
        String linkedWorkItems,
        String workItemAttachments
) {
    public static final FieldSelector BASIC = new FieldSelector("@basic", null, null);
    public static final FieldSelector ALL = new FieldSelector("@all", "@all", "@all");
    public static final FieldSelector DEFAULT = new FieldSelector("@basic", "id,role,suspect", "@basic");

    public static FieldSelector workItemFields(String fields) {
        return new FieldSelector(fields, null, null);
    }

    public FieldSelector withWorkItems(String fields) {
        return new FieldSelector(fields, linkedWorkItems, workItemAttachments);
    }

    public FieldSelector withLinkedWorkItems(String fields) {
        return new FieldSelector(workItems, fields, workItemAttachments);
    }

    public FieldSelector withWorkItemAttachments(String fields) {
        return new FieldSelector(workItems, linkedWorkItems, fields);
    }

    public Map<String, String> toQueryParams() {
        Map<String, String> params = new LinkedHashMap<>();
        if (workItems != null && !workItems.isEmpty()) {
            params.put("fields[workitems]", workItems);
        }
        if (linkedWorkItems != null && !linkedWorkItems.isEmpty()) {
            params.put("fields[linkedworkitems]", linkedWorkItems);
        }
        if (workItemAttachments != null && !workItemAttachments.isEmpty()) {
            params.put("fields[workitem_attachments]", workItemAttachments);
        }
        return params;
    }
}
