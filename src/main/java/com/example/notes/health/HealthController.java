package com.example.notes.health;

import com.example.notes.config.NotesProperties;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.info.BuildProperties;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HealthController {

    private final BuildProperties buildProperties;
    private final NotesProperties notesProperties;
    private final Clock clock;
    private final String env;

    public HealthController(@Value("${app.env:local}") String env,
                            ObjectProvider<BuildProperties> buildProperties,
                            NotesProperties notesProperties,
                            Clock clock) {
        this.env = env;
        this.buildProperties = buildProperties.getIfAvailable();
        this.notesProperties = notesProperties;
        this.clock = clock;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of(
                "status", "ok",
                "ts", Instant.now(clock).toString(),
                "env", env,
                "app", buildProperties != null ? buildProperties.getName() : "notes-store",
                "version", buildProperties != null ? buildProperties.getVersion() : "dev",
                "store_configured", notesProperties.hasTableName()
        ));
    }
}
