package io.github.drompincen.polarionclient.client.model;

import io.github.drompincen.polarionclient.protocol.api.TextContent;
import io.github.drompincen.polarionclient.runtime.schema.FieldDefinition;
import io.github.drompincen.polarionclient.runtime.schema.FieldTypes;
import io.github.drompincen.polarionclient.runtime.schema.ResourceSchema;

import java.time.OffsetDateTime;
import java.util.List;

public final class CommentFields {

    public static final String RESOURCE_TYPE = "workitem_comments";

    public static final FieldDefinition<TextContent> TEXT = FieldDefinition.of("text", FieldTypes.TEXT);
    public static final FieldDefinition<String> TITLE = FieldDefinition.of("title", FieldTypes.STRING);
    public static final FieldDefinition<Boolean> RESOLVED = FieldDefinition.of("resolved", FieldTypes.BOOLEAN);
    public static final FieldDefinition<OffsetDateTime> CREATED = FieldDefinition.readOnly("created", FieldTypes.TIMESTAMP);
    public static final FieldDefinition<List<String>> CHILD_COMMENT_IDS =
            FieldDefinition.readOnly("childCommentIds", FieldTypes.STRING_LIST);

    public static final String AUTHOR = "author";
    public static final String PARENT_COMMENT = "parentComment";
    public static final String CHILD_COMMENTS = "childComments";
    public static final String WORK_ITEM = "workItem";
    public static final String PROJECT = "project";

    public static final ResourceSchema SCHEMA = ResourceSchema.builder(RESOURCE_TYPE)
            .fields(TEXT, TITLE, RESOLVED, CREATED, CHILD_COMMENT_IDS)
            .relationships(AUTHOR, PARENT_COMMENT, CHILD_COMMENTS, WORK_ITEM, PROJECT)
            .build();

    private CommentFields() {}
}
