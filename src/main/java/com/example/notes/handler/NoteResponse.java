package com.example.notes.handler;

import java.util.Map;

/**
 * What a handler answers: a status code, response headers and an already-encoded JSON body.
 */
public record NoteResponse(
        int statusCode,
        Map<String, String> headers,
        String body
) {

    public static final String CONTENT_TYPE = "Content-Type";
    public static final String APPLICATION_JSON = "application/json";

    public NoteResponse {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public static NoteResponse json(int statusCode, String body) {
        return new NoteResponse(statusCode, Map.of(CONTENT_TYPE, APPLICATION_JSON), body);
    }
}
