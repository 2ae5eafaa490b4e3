package com.example.notes.access;

import com.example.notes.config.NotesProperties;
import com.example.notes.error.NotesException;
import com.example.notes.models.Note;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Expression;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryConditional;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.ReturnValue;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemRequest;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemResponse;

@Component
@Slf4j
public class DynamoNoteAccess implements NoteAccess {

    private static final TableSchema<Note> SCHEMA = TableSchema.fromBean(Note.class);

    private static final Expression NOTE_ABSENT = Expression.builder()
            .expression("attribute_not_exists(#id)")
            .putExpressionName("#id", Note.ID_ATTRIBUTE)
            .build();

    private static final Expression NOTE_PRESENT = Expression.builder()
            .expression("attribute_exists(#id)")
            .putExpressionName("#id", Note.ID_ATTRIBUTE)
            .build();

    private static final String UPDATE_EXPRESSION =
            "SET #title = :title, #note = :note, #updated_at = :ts";

    private final DynamoDbEnhancedClient enhancedClient;
    private final DynamoDbClient dynamo;
    private final NotesProperties properties;

    public DynamoNoteAccess(DynamoDbEnhancedClient enhancedClient,
                            DynamoDbClient dynamo,
                            NotesProperties properties) {
        this.enhancedClient = enhancedClient;
        this.dynamo = dynamo;
        this.properties = properties;
    }

    @Override
    public void putIfAbsent(Note note) {
        DynamoDbTable<Note> table = table();
        try {
            table.putItem(r -> r.item(note).conditionExpression(NOTE_ABSENT));
        } catch (ConditionalCheckFailedException ex) {
            throw NotesException.noteAlreadyExists(note.getId());
        } catch (SdkException ex) {
            throw NotesException.storeUnavailable("PutItem", ex);
        }
    }

    @Override
    public Note updateIfPresent(String id, String title, String note, String updatedAt) {
        // The enhanced client writes whole beans, so the partial update goes through the low-level client.
        UpdateItemRequest request = UpdateItemRequest.builder()
                .tableName(tableName())
                .key(keyAttributes(id))
                .updateExpression(UPDATE_EXPRESSION)
                .conditionExpression(NOTE_PRESENT.expression())
                .expressionAttributeNames(Map.of(
                        "#id", Note.ID_ATTRIBUTE,
                        "#title", Note.TITLE_ATTRIBUTE,
                        "#note", Note.NOTE_ATTRIBUTE,
                        "#updated_at", Note.UPDATED_AT_ATTRIBUTE))
                .expressionAttributeValues(Map.of(
                        ":title", AttributeValue.builder().s(title).build(),
                        ":note", AttributeValue.builder().s(note).build(),
                        ":ts", AttributeValue.builder().s(updatedAt).build()))
                .returnValues(ReturnValue.ALL_NEW)
                .build();

        UpdateItemResponse response;
        try {
            response = dynamo.updateItem(request);
        } catch (ConditionalCheckFailedException ex) {
            throw NotesException.noteNotFound(id);
        } catch (SdkException ex) {
            throw NotesException.storeUnavailable("UpdateItem", ex);
        }
        return SCHEMA.mapToItem(response.attributes());
    }

    @Override
    public void deleteIfPresent(String id) {
        DynamoDbTable<Note> table = table();
        try {
            table.deleteItem(r -> r.key(key(id)).conditionExpression(NOTE_PRESENT));
        } catch (ConditionalCheckFailedException ex) {
            throw NotesException.noteNotFound(id);
        } catch (SdkException ex) {
            throw NotesException.storeUnavailable("DeleteItem", ex);
        }
    }

    @Override
    public List<Note> listByOwner() {
        DynamoDbTable<Note> table = table();
        try {
            return table.query(r -> r.queryConditional(QueryConditional.keyEqualTo(
                            Key.builder().partitionValue(properties.getOwner()).build())))
                    .items()
                    .stream()
                    .collect(Collectors.toList());
        } catch (SdkException ex) {
            throw NotesException.storeUnavailable("Query", ex);
        }
    }

    private DynamoDbTable<Note> table() {
        return enhancedClient.table(tableName(), SCHEMA);
    }

    private String tableName() {
        if (!properties.hasTableName()) {
            log.error("Store access attempted without {}", NotesProperties.TABLE_NAME_ENV);
            throw NotesException.configurationMissing(NotesProperties.TABLE_NAME_ENV);
        }
        return properties.getTableName();
    }

    private Key key(String id) {
        return Key.builder()
                .partitionValue(properties.getOwner())
                .sortValue(id)
                .build();
    }

    private Map<String, AttributeValue> keyAttributes(String id) {
        return Map.of(
                Note.OWNER_ATTRIBUTE, AttributeValue.builder().s(properties.getOwner()).build(),
                Note.ID_ATTRIBUTE, AttributeValue.builder().s(id).build());
    }
}
