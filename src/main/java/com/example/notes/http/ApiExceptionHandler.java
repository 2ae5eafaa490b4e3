package com.example.notes.http;

import com.example.notes.responses.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Last-resort mapping for anything that escapes the note handlers. Framework errors keep their
 * own status; everything else is a generic 500.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    static final String INTERNAL_ERROR = "Internal server error";

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> boom(Exception ex) {
        if (ex instanceof org.springframework.web.ErrorResponse framework) {
            HttpStatusCode status = framework.getStatusCode();
            log.warn("Request failed with {}: {}", status, ex.getMessage());
            return ResponseEntity.status(status)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(new ErrorResponse(reason(status)));
        }

        log.error("Unexpected error handling request", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .contentType(MediaType.APPLICATION_JSON)
                .body(new ErrorResponse(INTERNAL_ERROR));
    }

    private static String reason(HttpStatusCode status) {
        HttpStatus resolved = HttpStatus.resolve(status.value());
        return resolved != null ? resolved.getReasonPhrase() : "Request failed";
    }
}
