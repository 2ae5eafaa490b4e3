package com.example.notes.codec;

import java.util.Objects;

/**
 * Validated create/update body: both fields trimmed and non-empty.
 */
public record NotePayload(
        String title,
        String note
) {
    public NotePayload {
        Objects.requireNonNull(title, "title");
        if (title.isBlank()) {
            throw new IllegalArgumentException("title must be non-blank");
        }

        Objects.requireNonNull(note, "note");
        if (note.isBlank()) {
            throw new IllegalArgumentException("note must be non-blank");
        }
    }
}
