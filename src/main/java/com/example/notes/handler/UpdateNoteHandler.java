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
 * PUT /notes/{id}. Replaces title and note of an existing note and refreshes updated_at; the
 * existence check is the update's own {@code attribute_exists} condition.
 */
@Component
@Slf4j
public class UpdateNoteHandler extends AbstractNoteHandler {

    static final String FAILURE_MESSAGE = "Failed to update note";

    public UpdateNoteHandler(NotesProperties properties, NoteAccess noteAccess, NoteCodec codec) {
        super(properties, noteAccess, codec);
    }

    @Override
    public NoteResponse handle(NoteRequest request) {
        Optional<NoteResponse> misconfigured = checkConfiguration();
        if (misconfigured.isPresent()) {
            return misconfigured.get();
        }

        String id;
        NotePayload payload;
        try {
            id = codec.extractPathId(request);
            payload = codec.parsePayload(request.body());
        } catch (NotesException ex) {
            return badRequest(ex);
        }

        Note updated;
        try {
            updated = noteAccess.updateIfPresent(id, payload.title(), payload.note(), codec.now());
        } catch (NotesException ex) {
            if (ex.getCode() == NotesException.Code.NOTE_NOT_FOUND) {
                return notFound(id);
            }
            return storeFailure(FAILURE_MESSAGE, ex);
        }

        log.info("Updated note {}", id);
        return codec.respond(OK, codec.toItem(updated));
    }
}
