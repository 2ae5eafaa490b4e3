package com.example.notes.access;

import com.example.notes.models.Note;
import java.util.List;

/**
 * Conditional single-key operations on the notes partition of the configured owner. Each mutating
 * call checks existence and writes in one atomic store step.
 *
 * <p>Failures surface as {@link com.example.notes.error.NotesException}: condition failures as
 * {@code NOTE_ALREADY_EXISTS} / {@code NOTE_NOT_FOUND}, anything else from the store as
 * {@code STORE_UNAVAILABLE}.
 */
public interface NoteAccess {

    /**
     * Inserts a note only if no note with the same (owner, id) exists.
     */
    void putIfAbsent(Note note);

    /**
     * Sets title, note and updated_at on an existing note and returns the note as stored after the
     * update. created_at is left untouched.
     */
    Note updateIfPresent(String id, String title, String note, String updatedAt);

    /**
     * Removes an existing note.
     */
    void deleteIfPresent(String id);

    /**
     * All notes of the configured owner, in no particular order.
     */
    List<Note> listByOwner();
}
