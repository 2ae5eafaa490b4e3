package com.example.notes.handler;

import com.example.notes.access.NoteAccess;
import com.example.notes.codec.NoteCodec;
import com.example.notes.config.NotesProperties;
import com.example.notes.error.NotesException;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

@Slf4j
abstract class AbstractNoteHandler implements NoteHandler {

    static final int OK = 200;
    static final int CREATED = 201;
    static final int BAD_REQUEST = 400;
    static final int NOT_FOUND = 404;
    static final int INTERNAL_SERVER_ERROR = 500;

    static final String NOTE_NOT_FOUND_MESSAGE = "Note not found";

    protected final NotesProperties properties;
    protected final NoteAccess noteAccess;
    protected final NoteCodec codec;

    protected AbstractNoteHandler(NotesProperties properties, NoteAccess noteAccess, NoteCodec codec) {
        this.properties = properties;
        this.noteAccess = noteAccess;
        this.codec = codec;
    }

    /**
     * Returns the 500 response to send when the store target is not configured, before anything
     * else is looked at.
     */
    protected Optional<NoteResponse> checkConfiguration() {
        if (properties.hasTableName()) {
            return Optional.empty();
        }
        NotesException ex = NotesException.configurationMissing(NotesProperties.TABLE_NAME_ENV);
        log.error("Rejecting request: {}", ex.getMessage());
        return Optional.of(codec.error(INTERNAL_SERVER_ERROR, ex.getMessage()));
    }

    protected NoteResponse badRequest(NotesException ex) {
        log.warn("Rejecting request ({}): {}", ex.getCode(), ex.getMessage());
        return codec.error(BAD_REQUEST, ex.getMessage());
    }

    protected NoteResponse notFound(String id) {
        log.warn("Note {} not found", id);
        return codec.error(NOT_FOUND, NOTE_NOT_FOUND_MESSAGE);
    }

    protected NoteResponse storeFailure(String message, NotesException ex) {
        log.error("{} ({}): {}", message, ex.getCode(), ex.getMessage(), ex);
        return codec.error(INTERNAL_SERVER_ERROR, message);
    }
}
