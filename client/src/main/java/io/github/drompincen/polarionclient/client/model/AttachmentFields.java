package io.github.drompincen.polarionclient.client.model;

import io.github.drompincen.polarionclient.runtime.schema.FieldDefinition;
import io.github.drompincen.polarionclient.runtime.schema.FieldTypes;
import io.github.drompincen.polarionclient.runtime.schema.ResourceSchema;

import java.time.OffsetDateTime;

public final class AttachmentFields {

    public static final String RESOURCE_TYPE = "workitem_attachments";

    /** Attachment id local to its work item, repeated as an attribute. */
    public static final FieldDefinition<String> ATTACHMENT_ID = FieldDefinition.readOnly("id", FieldTypes.STRING);
    public static final FieldDefinition<String> FILE_NAME = FieldDefinition.of("fileName", FieldTypes.STRING);
    public static final FieldDefinition<String> TITLE = FieldDefinition.of("title", FieldTypes.STRING);
    public static final FieldDefinition<Long> LENGTH = FieldDefinition.readOnly("length", FieldTypes.INTEGER);
    public static final FieldDefinition<OffsetDateTime> UPDATED = FieldDefinition.readOnly("updated", FieldTypes.TIMESTAMP);

    public static final ResourceSchema SCHEMA = ResourceSchema.builder(RESOURCE_TYPE)
            .fields(ATTACHMENT_ID, FILE_NAME, TITLE, LENGTH, UPDATED)
            .relationships("author", "project")
            .build();

    private AttachmentFields() {}
}
