package com.example.notes.handler;

import com.example.notes.access.NoteAccess;
import com.example.notes.codec.NoteCodec;
import com.example.notes.codec.NotePayload;
import com.example.notes.config.NotesProperties;
import com.example.notes.error.NotesException;
import com.example.notes.models.Note;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * POST /notes. Mints an id and a timestamp and inserts the note under an
 * {@code attribute_not_exists} condition. An id collision is reported as a plain 500.
 */
@Component
@Slf4j
public class CreateNoteHandler extends AbstractNoteHandler {

    static final String FAILURE_MESSAGE = "Failed to create note";

    public CreateNoteHandler(NotesProperties properties, NoteAccess noteAccess, NoteCodec codec) {
        super(properties, noteAccess, codec);
    }

    @Override
    public NoteResponse handle(NoteRequest request) {
        Optional<NoteResponse> misconfigured = checkConfiguration();
        if (misconfigured.isPresent()) {
            return misconfigured.get();
        }

        NotePayload payload;
        try {
            payload = codec.parsePayload(request.body());
        } catch (NotesException ex) {
            return badRequest(ex);
        }

        String now = codec.now();
        Note note = Note.builder()
                .owner(properties.getOwner())
                .id(codec.newId())
                .title(payload.title())
                .note(payload.note())
                .createdAt(now)
                .updatedAt(now)
                .build();

        try {
            noteAccess.putIfAbsent(note);
        } catch (NotesException ex) {
            return storeFailure(FAILURE_MESSAGE, ex);
        }

        log.info("Created note {}", note.getId());
        return codec.respond(CREATED, codec.toCreated(note));
    }
}
