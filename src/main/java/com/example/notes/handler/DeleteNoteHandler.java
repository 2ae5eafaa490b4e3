package com.example.notes.handler;

import com.example.notes.access.NoteAccess;
import com.example.notes.codec.NoteCodec;
import com.example.notes.config.NotesProperties;
import com.example.notes.error.NotesException;
import com.example.notes.responses.MessageResponse;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * DELETE /notes/{id}. Permanently removes an existing note.
 */
@Component
@Slf4j
public class DeleteNoteHandler extends AbstractNoteHandler {

    static final String FAILURE_MESSAGE = "Failed to delete note";
    static final String DELETED_MESSAGE = "Note deleted";

    public DeleteNoteHandler(NotesProperties properties, NoteAccess noteAccess, NoteCodec codec) {
        super(properties, noteAccess, codec);
    }

    @Override
    public NoteResponse handle(NoteRequest request) {
        Optional<NoteResponse> misconfigured = checkConfiguration();
        if (misconfigured.isPresent()) {
            return misconfigured.get();
        }

        String id;
        try {
            id = codec.extractPathId(request);
        } catch (NotesException ex) {
            return badRequest(ex);
        }

        try {
            noteAccess.deleteIfPresent(id);
        } catch (NotesException ex) {
            if (ex.getCode() == NotesException.Code.NOTE_NOT_FOUND) {
                return notFound(id);
            }
            return storeFailure(FAILURE_MESSAGE, ex);
        }

        log.info("Deleted note {}", id);
        return codec.respond(OK, new MessageResponse(DELETED_MESSAGE));
    }
}
