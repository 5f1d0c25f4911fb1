package io.github.drompincen.polarionclient.client.model;

import io.github.drompincen.polarionclient.protocol.api.TextContent;
import io.github.drompincen.polarionclient.runtime.schema.FieldDefinition;
import io.github.drompincen.polarionclient.runtime.schema.FieldTypes;
import io.github.drompincen.polarionclient.runtime.schema.ResourceSchema;

import java.time.LocalDate;

public final class ProjectFields {

    public static final String RESOURCE_TYPE = "projects";

    public static final FieldDefinition<String> NAME = FieldDefinition.of("name", FieldTypes.STRING);
    public static final FieldDefinition<TextContent> DESCRIPTION = FieldDefinition.of("description", FieldTypes.TEXT);
    public static final FieldDefinition<Boolean> ACTIVE = FieldDefinition.of("active", FieldTypes.BOOLEAN);
    public static final FieldDefinition<String> LOCATION = FieldDefinition.of("location", FieldTypes.STRING);
    public static final FieldDefinition<String> LEAD = FieldDefinition.of("lead", FieldTypes.STRING);
    public static final FieldDefinition<LocalDate> START_DATE = FieldDefinition.of("startDate", FieldTypes.DATE);
    public static final FieldDefinition<LocalDate> FINISH_DATE = FieldDefinition.of("finishDate", FieldTypes.DATE);

    public static final ResourceSchema SCHEMA = ResourceSchema.builder(RESOURCE_TYPE)
            .fields(NAME, DESCRIPTION, ACTIVE, LOCATION, LEAD, START_DATE, FINISH_DATE)
            .build();

    private ProjectFields() {}
}
