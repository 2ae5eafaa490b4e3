package com.example.notes.error;

import lombok.Getter;

public class NotesException extends RuntimeException {

    public enum Code {
        CONFIGURATION_MISSING,
        VALIDATION_FAILED,
        MALFORMED_PAYLOAD,
        NOTE_NOT_FOUND,
        NOTE_ALREADY_EXISTS,
        STORE_UNAVAILABLE
    }

    @Getter
    private final Code code;

    private NotesException(Code code, String message) {
        super(message);
        this.code = code;
    }

    private NotesException(Code code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public static NotesException configurationMissing(String setting) {
        return new NotesException(Code.CONFIGURATION_MISSING,
                setting + " environment variable is required");
    }

    public static NotesException validationFailed(String message) {
        return new NotesException(Code.VALIDATION_FAILED, message);
    }

    public static NotesException malformedPayload(String detail, Throwable cause) {
        return new NotesException(Code.MALFORMED_PAYLOAD, detail, cause);
    }

    public static NotesException noteNotFound(String id) {
        return new NotesException(Code.NOTE_NOT_FOUND, "Note " + id + " does not exist");
    }

    public static NotesException noteAlreadyExists(String id) {
        return new NotesException(Code.NOTE_ALREADY_EXISTS, "Note " + id + " already exists");
    }

    public static NotesException storeUnavailable(String operation, Throwable cause) {
        return new NotesException(Code.STORE_UNAVAILABLE,
                "Store call " + operation + " failed: " + cause.getMessage(), cause);
    }
}
