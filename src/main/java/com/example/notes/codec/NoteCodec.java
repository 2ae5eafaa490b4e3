package com.example.notes.codec;

import com.example.notes.error.NotesException;
import com.example.notes.handler.NoteRequest;
import com.example.notes.handler.NoteResponse;
import com.example.notes.models.Note;
import com.example.notes.responses.CreatedNoteResponse;
import com.example.notes.responses.ErrorResponse;
import com.example.notes.responses.NoteItemResponse;
import com.example.notes.responses.NoteListResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.function.Supplier;

/**
 * Translates between wire payloads and {@link Note} records: validates create/update bodies and
 * path ids, mints ids and timestamps, and encodes handler responses as JSON.
 */
public class NoteCodec {

    /** Fixed-width UTC timestamps, so string order is time order. */
    public static final DateTimeFormatter TIMESTAMP_FORMATTER =
            DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSSSSSxxx").withZone(ZoneOffset.UTC);

    public static final String INVALID_BODY = "Invalid request body: ";
    public static final String ID_REQUIRED = "Note id is required";
    public static final String ID_PATH_PARAMETER = "id";

    private final ObjectMapper objectMapper;
    private final ObjectReader bodyReader;
    private final Clock clock;
    private final Supplier<String> idGenerator;

    public NoteCodec(ObjectMapper objectMapper, Clock clock, Supplier<String> idGenerator) {
        this.objectMapper = objectMapper;
        // A body is one JSON document; anything after it makes the whole body unparseable.
        this.bodyReader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        this.clock = clock;
        this.idGenerator = idGenerator;
    }

    public NotePayload parsePayload(String rawBody) {
        String body = (rawBody == null || rawBody.isBlank()) ? "{}" : rawBody;

        JsonNode root;
        try {
            root = bodyReader.readTree(body);
        } catch (JsonProcessingException ex) {
            throw NotesException.malformedPayload(INVALID_BODY + "body is not valid JSON", ex);
        }
        if (root == null || !root.isObject()) {
            throw NotesException.malformedPayload(INVALID_BODY + "body must be a JSON object", null);
        }

        String title = textField(root, Note.TITLE_ATTRIBUTE);
        String note = textField(root, Note.NOTE_ATTRIBUTE);

        if (title.isEmpty()) {
            throw NotesException.validationFailed(INVALID_BODY + "title is required");
        }
        if (note.isEmpty()) {
            throw NotesException.validationFailed(INVALID_BODY + "note is required");
        }
        return new NotePayload(title, note);
    }

    public String extractPathId(NoteRequest request) {
        String id = request == null ? null : request.pathParameter(ID_PATH_PARAMETER);
        if (id == null || id.isBlank()) {
            throw NotesException.validationFailed(ID_REQUIRED);
        }
        return id.strip();
    }

    public String newId() {
        return idGenerator.get();
    }

    public String now() {
        return TIMESTAMP_FORMATTER.format(clock.instant());
    }

    public CreatedNoteResponse toCreated(Note note) {
        return new CreatedNoteResponse(note.getId(), note.getTitle(), note.getNote());
    }

    public NoteItemResponse toItem(Note note) {
        return new NoteItemResponse(
                note.getOwner(),
                note.getId(),
                note.getTitle(),
                note.getNote(),
                note.getCreatedAt(),
                note.getUpdatedAt()
        );
    }

    public NoteListResponse toList(List<Note> notes) {
        return new NoteListResponse(notes.stream().map(this::toItem).toList());
    }

    public NoteResponse respond(int statusCode, Object payload) {
        try {
            return NoteResponse.json(statusCode, objectMapper.writeValueAsString(payload));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to encode response payload", ex);
        }
    }

    public NoteResponse error(int statusCode, String message) {
        return respond(statusCode, new ErrorResponse(message));
    }

    private static String textField(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return "";
        }
        if (!node.isValueNode()) {
            throw NotesException.validationFailed(INVALID_BODY + field + " must be text");
        }
        return node.asText().strip();
    }
}
