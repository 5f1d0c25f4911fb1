package io.github.drompincen.polarionclient.client.model;

import io.github.drompincen.polarionclient.runtime.schema.FieldDefinition;
import io.github.drompincen.polarionclient.runtime.schema.FieldTypes;
import io.github.drompincen.polarionclient.runtime.schema.ResourceSchema;

import java.time.OffsetDateTime;

/**
 * Work item approval records. The status values are those of
 * {@link io.github.drompincen.polarionclient.protocol.api.ApprovalStatus}.
 */
public final class ApprovalFields {

    public static final String RESOURCE_TYPE = "workitem_approvals";

    public static final FieldDefinition<String> STATUS = FieldDefinition.of("status", FieldTypes.STRING);
    public static final FieldDefinition<String> COMMENT = FieldDefinition.of("comment", FieldTypes.STRING);
    public static final FieldDefinition<OffsetDateTime> DATE = FieldDefinition.readOnly("date", FieldTypes.TIMESTAMP);

    public static final String USER = "user";

    public static final ResourceSchema SCHEMA = ResourceSchema.builder(RESOURCE_TYPE)
            .fields(STATUS, COMMENT, DATE)
            .relationships(USER, "project")
            .build();

    private ApprovalFields() {}
}
