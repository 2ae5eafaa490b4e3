package com.example.notes.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.NonNull;
import lombok.Setter;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSortKey;

/**
 * A single note. Items live in one partition per owner and are addressed by (owner, id);
 * a stored note always carries all six attributes.
 */
@JsonInclude(Include.NON_NULL)
@DynamoDbBean
@NoArgsConstructor                     // needed for DynamoDB Enhanced Client reflection
@AllArgsConstructor(access = AccessLevel.PRIVATE) // used by Lombok @Builder
@Builder(toBuilder = true)
@Getter @Setter
public class Note {

    public static final String OWNER_ATTRIBUTE = "owner";
    public static final String ID_ATTRIBUTE = "id";
    public static final String TITLE_ATTRIBUTE = "title";
    public static final String NOTE_ATTRIBUTE = "note";
    public static final String CREATED_AT_ATTRIBUTE = "created_at";
    public static final String UPDATED_AT_ATTRIBUTE = "updated_at";

    @NonNull
    private String owner;

    @NonNull
    private String id;

    @NonNull
    private String title;

    @NonNull
    private String note;

    @NonNull
    private String createdAt;

    @NonNull
    private String updatedAt;

    // ----- DynamoDB Enhanced annotations on getters -----

    @DynamoDbPartitionKey
    @DynamoDbAttribute(OWNER_ATTRIBUTE)
    public String getOwner() { return owner; }

    @DynamoDbSortKey
    @DynamoDbAttribute(ID_ATTRIBUTE)
    public String getId() { return id; }

    @DynamoDbAttribute(TITLE_ATTRIBUTE)
    public String getTitle() { return title; }

    @DynamoDbAttribute(NOTE_ATTRIBUTE)
    public String getNote() { return note; }

    @DynamoDbAttribute(CREATED_AT_ATTRIBUTE)
    public String getCreatedAt() { return createdAt; }

    @DynamoDbAttribute(UPDATED_AT_ATTRIBUTE)
    public String getUpdatedAt() { return updatedAt; }
}
