package com.example.notes.responses;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record NoteListResponse(
        @JsonProperty("items") List<NoteItemResponse> items
) {
    public NoteListResponse {
        items = items == null ? List.of() : List.copyOf(items);
    }
}
