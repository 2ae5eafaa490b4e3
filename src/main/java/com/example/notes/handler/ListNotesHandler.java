package com.example.notes.handler;

import com.example.notes.access.NoteAccess;
import com.example.notes.codec.NoteCodec;
import com.example.notes.config.NotesProperties;
import com.example.notes.error.NotesException;
import com.example.notes.models.Note;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * GET /notes. Returns every note of the owner partition; item order is whatever the store yields.
 */
@Component
@Slf4j
public class ListNotesHandler extends AbstractNoteHandler {

    static final String FAILURE_MESSAGE = "Failed to list notes";

    public ListNotesHandler(NotesProperties properties, NoteAccess noteAccess, NoteCodec codec) {
        super(properties, noteAccess, codec);
    }

    @Override
    public NoteResponse handle(NoteRequest request) {
        Optional<NoteResponse> misconfigured = checkConfiguration();
        if (misconfigured.isPresent()) {
            return misconfigured.get();
        }

        List<Note> notes;
        try {
            notes = noteAccess.listByOwner();
        } catch (NotesException ex) {
            return storeFailure(FAILURE_MESSAGE, ex);
        }

        log.debug("Listed {} notes", notes.size());
        return codec.respond(OK, codec.toList(notes));
    }
}
