package com.example.notes.config;

import jakarta.validation.constraints.NotBlank;
import java.util.function.Function;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Store target settings, bound from application.yml (notes.*).
 * A blank table name does not fail startup; every handler reports it per request instead.
 */
@Component
@ConfigurationProperties(prefix = "notes")
@Validated
@Data
public class NotesProperties {

    public static final String TABLE_NAME_ENV = "NOTES_TABLE_NAME";
    public static final String OWNER_ENV = "NOTES_OWNER";
    public static final String DEFAULT_OWNER = "global";

    private String tableName = "";

    @NotBlank
    private String owner = DEFAULT_OWNER;

    public void setTableName(String tableName) {
        this.tableName = trimToEmpty(tableName);
    }

    public boolean hasTableName() {
        return !tableName.isEmpty();
    }

    /**
     * Builds the same settings from environment variables, for runtimes started without Spring.
     */
    public static NotesProperties fromEnvironment(Function<String, String> env) {
        NotesProperties properties = new NotesProperties();
        properties.setTableName(env.apply(TABLE_NAME_ENV));
        String owner = trimToEmpty(env.apply(OWNER_ENV));
        properties.setOwner(owner.isEmpty() ? DEFAULT_OWNER : owner);
        return properties;
    }

    private static String trimToEmpty(String value) {
        return value == null ? "" : value.trim();
    }
}
