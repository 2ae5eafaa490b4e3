package com.example.notes.responses;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record NoteItemResponse(
        @JsonProperty("owner") String owner,
        @JsonProperty("id") String id,
        @JsonProperty("title") String title,
        @JsonProperty("note") String note,
        @JsonProperty("created_at") String createdAt,
        @JsonProperty("updated_at") String updatedAt
) {}
