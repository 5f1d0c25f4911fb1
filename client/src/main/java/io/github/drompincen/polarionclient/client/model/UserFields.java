package io.github.drompincen.polarionclient.client.model;

import io.github.drompincen.polarionclient.protocol.api.TextContent;
import io.github.drompincen.polarionclient.runtime.schema.FieldDefinition;
import io.github.drompincen.polarionclient.runtime.schema.FieldTypes;
import io.github.drompincen.polarionclient.runtime.schema.ResourceSchema;

public final class UserFields {

    public static final String RESOURCE_TYPE = "users";

    public static final FieldDefinition<String> NAME = FieldDefinition.of("name", FieldTypes.STRING);
    public static final FieldDefinition<String> EMAIL = FieldDefinition.of("email", FieldTypes.STRING);
    public static final FieldDefinition<TextContent> DESCRIPTION = FieldDefinition.of("description", FieldTypes.TEXT);
    public static final FieldDefinition<Boolean> DISABLED = FieldDefinition.of("disabled", FieldTypes.BOOLEAN);
    public static final FieldDefinition<Boolean> DISABLED_FOR_UI = FieldDefinition.of("disabledForUi", FieldTypes.BOOLEAN);
    public static final FieldDefinition<Boolean> VAULT_USER = FieldDefinition.of("vaultUser", FieldTypes.BOOLEAN);

    public static final ResourceSchema SCHEMA = ResourceSchema.builder(RESOURCE_TYPE)
            .fields(NAME, EMAIL, DESCRIPTION, DISABLED, DISABLED_FOR_UI, VAULT_USER)
            .relationships("avatar", "userGroups", "globalRoles", "projectRoles")
            .build();

    private UserFields() {}
}
