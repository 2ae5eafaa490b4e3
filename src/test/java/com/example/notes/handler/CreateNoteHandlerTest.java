package com.example.notes.handler;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;

import com.example.notes.MutableClock;
import com.example.notes.access.InMemoryNoteAccess;
import com.example.notes.codec.NoteCodec;
import com.example.notes.config.NotesProperties;
import com.example.notes.models.Note;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CreateNoteHandlerTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private MutableClock clock;
    private NotesProperties properties;
    private InMemoryNoteAccess noteAccess;
    private CreateNoteHandler handler;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-10-01T08:00:00Z"));
        properties = new NotesProperties();
        properties.setTableName("notes");
        noteAccess = new InMemoryNoteAccess(properties.getOwner());
        AtomicInteger seq = new AtomicInteger();
        handler = new CreateNoteHandler(properties, noteAccess,
                new NoteCodec(MAPPER, clock, () -> "note-" + seq.incrementAndGet()));
    }

    @Test
    @DisplayName("creates a note with generated id and equal timestamps")
    void createsNote() throws Exception {
        NoteResponse response = handler.handle(NoteRequest.withBody("{\"title\":\"A\",\"note\":\"B\"}"));

        assertEquals(201, response.statusCode());
        assertEquals("application/json", response.headers().get("Content-Type"));
        JsonNode body = MAPPER.readTree(response.body());
        assertEquals("note-1", body.get("id").asText());
        assertEquals("A", body.get("title").asText());
        assertEquals("B", body.get("note").asText());
        assertEquals(3, body.size());

        Note stored = noteAccess.get("note-1");
        assertNotNull(stored);
        assertEquals("global", stored.getOwner());
        assertEquals("2024-10-01T08:00:00.000000+00:00", stored.getCreatedAt());
        assertEquals(stored.getCreatedAt(), stored.getUpdatedAt());
    }

    @Test
    @DisplayName("trims title and note before storing")
    void trimsFields() throws Exception {
        NoteResponse response = handler.handle(
                NoteRequest.withBody("{\"title\":\"  Groceries \",\"note\":\"\\tmilk\\n\"}"));

        assertEquals(201, response.statusCode());
        Note stored = noteAccess.get("note-1");
        assertEquals("Groceries", stored.getTitle());
        assertEquals("milk", stored.getNote());
    }

    @Test
    @DisplayName("ignores a caller-supplied id")
    void ignoresCallerId() throws Exception {
        NoteResponse response = handler.handle(
                NoteRequest.withBody("{\"id\":\"mine\",\"title\":\"A\",\"note\":\"B\"}"));

        assertEquals(201, response.statusCode());
        assertEquals("note-1", MAPPER.readTree(response.body()).get("id").asText());
        assertNull(noteAccess.get("mine"));
    }

    @Test
    @DisplayName("returns 400 without touching the store when title is empty")
    void rejectsEmptyTitle() throws Exception {
        NoteResponse response = handler.handle(NoteRequest.withBody("{\"title\":\"\",\"note\":\"x\"}"));

        assertEquals(400, response.statusCode());
        assertEquals("Invalid request body: title is required",
                MAPPER.readTree(response.body()).get("error").asText());
        assertEquals(0, noteAccess.calls());
    }

    @Test
    @DisplayName("returns 400 when note is missing or whitespace")
    void rejectsMissingNote() throws Exception {
        NoteResponse missing = handler.handle(NoteRequest.withBody("{\"title\":\"A\"}"));
        NoteResponse blank = handler.handle(NoteRequest.withBody("{\"title\":\"A\",\"note\":\"   \"}"));

        assertEquals(400, missing.statusCode());
        assertEquals("Invalid request body: note is required",
                MAPPER.readTree(missing.body()).get("error").asText());
        assertEquals(400, blank.statusCode());
        assertEquals(0, noteAccess.calls());
    }

    @Test
    @DisplayName("returns 400 for a body that is not JSON")
    void rejectsMalformedBody() throws Exception {
        NoteResponse response = handler.handle(NoteRequest.withBody("{title: A"));

        assertEquals(400, response.statusCode());
        assertEquals("Invalid request body: body is not valid JSON",
                MAPPER.readTree(response.body()).get("error").asText());
        assertEquals(0, noteAccess.calls());
    }

    @Test
    @DisplayName("returns 400 and stores nothing when a valid object is followed by other text")
    void rejectsTrailingContent() throws Exception {
        NoteResponse response = handler.handle(NoteRequest.withBody("{\"title\":\"A\",\"note\":\"B\"} not json"));

        assertEquals(400, response.statusCode());
        assertEquals("Invalid request body: body is not valid JSON",
                MAPPER.readTree(response.body()).get("error").asText());
        assertEquals(0, noteAccess.size());
    }

    @Test
    @DisplayName("returns 500 before parsing when the table is not configured")
    void rejectsMissingConfiguration() throws Exception {
        properties.setTableName("  ");

        NoteResponse response = handler.handle(NoteRequest.withBody("not even json"));

        assertEquals(500, response.statusCode());
        assertEquals("NOTES_TABLE_NAME environment variable is required",
                MAPPER.readTree(response.body()).get("error").asText());
        assertEquals(0, noteAccess.calls());
    }

    @Test
    @DisplayName("returns a generic 500 when the store is unavailable")
    void storeUnavailable() throws Exception {
        noteAccess.setUnavailable(true);

        NoteResponse response = handler.handle(NoteRequest.withBody("{\"title\":\"A\",\"note\":\"B\"}"));

        assertEquals(500, response.statusCode());
        assertEquals("Failed to create note", MAPPER.readTree(response.body()).get("error").asText());
        assertEquals(1, noteAccess.calls());
    }

    @Test
    @DisplayName("an id collision is a 500 and leaves the existing note alone")
    void idCollision() throws Exception {
        CreateNoteHandler fixedIds = new CreateNoteHandler(properties, noteAccess,
                new NoteCodec(MAPPER, clock, () -> "same-id"));

        NoteResponse first = fixedIds.handle(NoteRequest.withBody("{\"title\":\"first\",\"note\":\"1\"}"));
        NoteResponse second = fixedIds.handle(NoteRequest.withBody("{\"title\":\"second\",\"note\":\"2\"}"));

        assertEquals(201, first.statusCode());
        assertEquals(500, second.statusCode());
        assertEquals("Failed to create note", MAPPER.readTree(second.body()).get("error").asText());
        assertEquals(1, noteAccess.size());
        assertEquals("first", noteAccess.get("same-id").getTitle());
    }

    @Test
    @DisplayName("two creates yield two distinct ids and records")
    void distinctIds() throws Exception {
        CreateNoteHandler randomIds = new CreateNoteHandler(properties, noteAccess,
                new NoteCodec(MAPPER, clock, () -> UUID.randomUUID().toString()));

        String first = MAPPER.readTree(randomIds.handle(
                NoteRequest.withBody("{\"title\":\"A\",\"note\":\"B\"}")).body()).get("id").asText();
        String second = MAPPER.readTree(randomIds.handle(
                NoteRequest.withBody("{\"title\":\"A\",\"note\":\"B\"}")).body()).get("id").asText();

        assertNotEquals(first, second);
        assertEquals(2, noteAccess.size());
    }
}
