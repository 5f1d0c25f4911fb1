package io.github.drompincen.polarionclient.client.model;

import io.github.drompincen.polarionclient.runtime.schema.FieldDefinition;
import io.github.drompincen.polarionclient.runtime.schema.FieldTypes;
import io.github.drompincen.polarionclient.runtime.schema.ResourceSchema;

/**
 * Links from a work item to another work item. The {@link #WORK_ITEM} relationship points at
 * the link target.
 */
public final class LinkFields {

    public static final String RESOURCE_TYPE = "linkedworkitems";

    public static final FieldDefinition<String> ROLE = FieldDefinition.of("role", FieldTypes.STRING);
    public static final FieldDefinition<Boolean> SUSPECT = FieldDefinition.of("suspect", FieldTypes.BOOLEAN);
    /** Pins the link to a revision of the target; absent means HEAD. */
    public static final FieldDefinition<String> REVISION = FieldDefinition.of("revision", FieldTypes.STRING);

    public static final String WORK_ITEM = "workItem";

    public static final ResourceSchema SCHEMA = ResourceSchema.builder(RESOURCE_TYPE)
            .fields(ROLE, SUSPECT, REVISION)
            .relationships(WORK_ITEM)
            .build();

    private LinkFields() {}
}
