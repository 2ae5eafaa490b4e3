package com.example.notes.handler;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.notes.MutableClock;
import com.example.notes.access.InMemoryNoteAccess;
import com.example.notes.codec.NoteCodec;
import com.example.notes.config.NotesProperties;
import com.example.notes.models.Note;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class UpdateNoteHandlerTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String CREATED = "2024-10-01T08:00:00.000000+00:00";

    private MutableClock clock;
    private NotesProperties properties;
    private InMemoryNoteAccess noteAccess;
    private UpdateNoteHandler handler;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-10-01T08:00:00Z"));
        properties = new NotesProperties();
        properties.setTableName("notes");
        noteAccess = new InMemoryNoteAccess(properties.getOwner());
        handler = new UpdateNoteHandler(properties, noteAccess, new NoteCodec(MAPPER, clock, () -> "unused"));

        noteAccess.seed(Note.builder()
                .owner("global")
                .id("n1")
                .title("old title")
                .note("old body")
                .createdAt(CREATED)
                .updatedAt(CREATED)
                .build());
    }

    @Test
    @DisplayName("replaces title and note, keeps id and created_at, refreshes updated_at")
    void updatesNote() throws Exception {
        clock.advance(Duration.ofMillis(1500));

        NoteResponse response = handler.handle(
                NoteRequest.forNote("n1", "{\"title\":\" new title \",\"note\":\"new body\"}"));

        assertEquals(200, response.statusCode());
        JsonNode body = MAPPER.readTree(response.body());
        assertEquals("global", body.get("owner").asText());
        assertEquals("n1", body.get("id").asText());
        assertEquals("new title", body.get("title").asText());
        assertEquals("new body", body.get("note").asText());
        assertEquals(CREATED, body.get("created_at").asText());
        assertEquals("2024-10-01T08:00:01.500000+00:00", body.get("updated_at").asText());
        assertTrue(body.get("updated_at").asText().compareTo(CREATED) > 0);

        Note stored = noteAccess.get("n1");
        assertEquals("new title", stored.getTitle());
        assertEquals(CREATED, stored.getCreatedAt());
    }

    @Test
    @DisplayName("trims the path id")
    void trimsPathId() {
        NoteResponse response = handler.handle(
                NoteRequest.forNote("  n1 ", "{\"title\":\"t\",\"note\":\"b\"}"));

        assertEquals(200, response.statusCode());
        assertEquals("t", noteAccess.get("n1").getTitle());
    }

    @Test
    @DisplayName("returns 404 and creates nothing for an unknown id")
    void unknownId() throws Exception {
        NoteResponse response = handler.handle(
                NoteRequest.forNote("ghost", "{\"title\":\"t\",\"note\":\"b\"}"));

        assertEquals(404, response.statusCode());
        assertEquals("Note not found", MAPPER.readTree(response.body()).get("error").asText());
        assertEquals(1, noteAccess.size());
        assertEquals("old title", noteAccess.get("n1").getTitle());
    }

    @Test
    @DisplayName("returns 400 when the path id is missing or blank")
    void missingId() throws Exception {
        NoteResponse blank = handler.handle(NoteRequest.forNote("   ", "{\"title\":\"t\",\"note\":\"b\"}"));
        NoteResponse absent = handler.handle(new NoteRequest(null, "{\"title\":\"t\",\"note\":\"b\"}"));

        assertEquals(400, blank.statusCode());
        assertEquals("Note id is required", MAPPER.readTree(blank.body()).get("error").asText());
        assertEquals(400, absent.statusCode());
        assertEquals(0, noteAccess.calls());
    }

    @Test
    @DisplayName("checks the id before the body")
    void idCheckedFirst() throws Exception {
        Map<String, String> params = new HashMap<>();
        params.put("id", null);

        NoteResponse response = handler.handle(new NoteRequest(params, "garbage"));

        assertEquals(400, response.statusCode());
        assertEquals("Note id is required", MAPPER.readTree(response.body()).get("error").asText());
    }

    @Test
    @DisplayName("returns 400 without store access for an empty title")
    void emptyTitle() throws Exception {
        NoteResponse response = handler.handle(NoteRequest.forNote("n1", "{\"title\":\"\",\"note\":\"x\"}"));

        assertEquals(400, response.statusCode());
        assertEquals("Invalid request body: title is required",
                MAPPER.readTree(response.body()).get("error").asText());
        assertEquals(0, noteAccess.calls());
        assertEquals("old title", noteAccess.get("n1").getTitle());
    }

    @Test
    @DisplayName("returns 500 before anything else when the table is not configured")
    void missingConfiguration() throws Exception {
        properties.setTableName("");

        NoteResponse response = handler.handle(NoteRequest.forNote(null, null));

        assertEquals(500, response.statusCode());
        assertEquals("NOTES_TABLE_NAME environment variable is required",
                MAPPER.readTree(response.body()).get("error").asText());
    }

    @Test
    @DisplayName("returns a generic 500 when the store fails")
    void storeUnavailable() throws Exception {
        noteAccess.setUnavailable(true);

        NoteResponse response = handler.handle(NoteRequest.forNote("n1", "{\"title\":\"t\",\"note\":\"b\"}"));

        assertEquals(500, response.statusCode());
        assertEquals("Failed to update note", MAPPER.readTree(response.body()).get("error").asText());
    }
}
