package com.example.notes.responses;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CreatedNoteResponse(
        @JsonProperty("id") String id,
        @JsonProperty("title") String title,
        @JsonProperty("note") String note
) {}
