package com.example.notes.config;

import com.example.notes.codec.NoteCodec;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.util.UUID;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class NotesConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public NoteCodec noteCodec(ObjectMapper objectMapper, Clock clock) {
        return new NoteCodec(objectMapper, clock, () -> UUID.randomUUID().toString());
    }
}
