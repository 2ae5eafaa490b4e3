package com.example.notes.handler;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Transport-neutral request handed to a note handler: the route's path parameters and the raw,
 * unparsed body. Either may be missing.
 */
public record NoteRequest(
        Map<String, String> pathParameters,
        String body
) {

    public NoteRequest {
        pathParameters = pathParameters == null
                ? Map.of()
                : Collections.unmodifiableMap(new HashMap<>(pathParameters));
    }

    public static NoteRequest withBody(String body) {
        return new NoteRequest(Map.of(), body);
    }

    public static NoteRequest forNote(String id, String body) {
        Map<String, String> params = new HashMap<>();
        params.put("id", id);
        return new NoteRequest(params, body);
    }

    public String pathParameter(String name) {
        return pathParameters.get(name);
    }
}
