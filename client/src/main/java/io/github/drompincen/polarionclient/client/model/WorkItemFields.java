package io.github.drompincen.polarionclient.client.model;

import io.github.drompincen.polarionclient.protocol.api.Hyperlink;
import io.github.drompincen.polarionclient.protocol.api.TextContent;
import io.github.drompincen.polarionclient.runtime.schema.FieldDefinition;
import io.github.drompincen.polarionclient.runtime.schema.FieldTypes;
import io.github.drompincen.polarionclient.runtime.schema.ResourceSchema;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Standard work item attributes. Everything else a server returns is a custom field.
 */
public final class WorkItemFields {

    public static final String RESOURCE_TYPE = "workitems";

    public static final FieldDefinition<String> TYPE = FieldDefinition.readOnly("type", FieldTypes.STRING);
    public static final FieldDefinition<OffsetDateTime> CREATED = FieldDefinition.readOnly("created", FieldTypes.TIMESTAMP);
    public static final FieldDefinition<OffsetDateTime> UPDATED = FieldDefinition.readOnly("updated", FieldTypes.TIMESTAMP);
    public static final FieldDefinition<String> TITLE = FieldDefinition.of("title", FieldTypes.STRING);
    public static final FieldDefinition<TextContent> DESCRIPTION = FieldDefinition.of("description", FieldTypes.TEXT);
    public static final FieldDefinition<String> STATUS = FieldDefinition.of("status", FieldTypes.STRING);
    public static final FieldDefinition<String> RESOLUTION = FieldDefinition.of("resolution", FieldTypes.STRING);
    public static final FieldDefinition<String> PRIORITY = FieldDefinition.of("priority", FieldTypes.STRING);
    public static final FieldDefinition<String> SEVERITY = FieldDefinition.of("severity", FieldTypes.STRING);
    public static final FieldDefinition<LocalDate> DUE_DATE = FieldDefinition.of("dueDate", FieldTypes.DATE);
    public static final FieldDefinition<OffsetDateTime> PLANNED_START = FieldDefinition.of("plannedStart", FieldTypes.TIMESTAMP);
    public static final FieldDefinition<OffsetDateTime> PLANNED_END = FieldDefinition.of("plannedEnd", FieldTypes.TIMESTAMP);
    // estimates stay strings, servers also send fractional hours ("1.5h")
    public static final FieldDefinition<String> INITIAL_ESTIMATE = FieldDefinition.of("initialEstimate", FieldTypes.STRING);
    public static final FieldDefinition<String> REMAINING_ESTIMATE = FieldDefinition.of("remainingEstimate", FieldTypes.STRING);
    public static final FieldDefinition<String> TIME_SPENT = FieldDefinition.of("timeSpent", FieldTypes.STRING);
    public static final FieldDefinition<String> OUTLINE_NUMBER = FieldDefinition.of("outlineNumber", FieldTypes.STRING);
    public static final FieldDefinition<OffsetDateTime> RESOLVED_ON = FieldDefinition.readOnly("resolvedOn", FieldTypes.TIMESTAMP);
    public static final FieldDefinition<List<Hyperlink>> HYPERLINKS = FieldDefinition.of("hyperlinks", FieldTypes.HYPERLINKS);

    public static final String ASSIGNEE = "assignee";
    public static final String AUTHOR = "author";
    public static final String CATEGORIES = "categories";
    public static final String PROJECT = "project";

    public static final ResourceSchema SCHEMA = ResourceSchema.builder(RESOURCE_TYPE)
            .fields(TYPE, CREATED, UPDATED, TITLE, DESCRIPTION, STATUS, RESOLUTION, PRIORITY, SEVERITY,
                    DUE_DATE, PLANNED_START, PLANNED_END, INITIAL_ESTIMATE, REMAINING_ESTIMATE, TIME_SPENT,
                    OUTLINE_NUMBER, RESOLVED_ON, HYPERLINKS)
            .relationships(ASSIGNEE, AUTHOR, CATEGORIES, "linkedWorkItems", "attachments", "comments",
                    "externallyLinkedWorkItems", "linkedOslcResources", "module", "moduleFolder", "plan",
                    PROJECT, "votes", "watches", "workRecords", "approvals")
            .build();

    private WorkItemFields() {}
}
