package com.example.notes.http;

import com.example.notes.handler.CreateNoteHandler;
import com.example.notes.handler.DeleteNoteHandler;
import com.example.notes.handler.ListNotesHandler;
import com.example.notes.handler.NoteRequest;
import com.example.notes.handler.NoteResponse;
import com.example.notes.handler.UpdateNoteHandler;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST entry point for notes. Bodies are taken as raw strings so that parsing and validation stay
 * with the handlers; each handler response is rendered as-is.
 */
@RestController
public class NoteController {

    private final CreateNoteHandler createHandler;
    private final ListNotesHandler listHandler;
    private final UpdateNoteHandler updateHandler;
    private final DeleteNoteHandler deleteHandler;

    public NoteController(CreateNoteHandler createHandler,
                          ListNotesHandler listHandler,
                          UpdateNoteHandler updateHandler,
                          DeleteNoteHandler deleteHandler) {
        this.createHandler = createHandler;
        this.listHandler = listHandler;
        this.updateHandler = updateHandler;
        this.deleteHandler = deleteHandler;
    }

    @PostMapping("/notes")
    public ResponseEntity<String> createNote(@RequestBody(required = false) String body) {
        return render(createHandler.handle(NoteRequest.withBody(body)));
    }

    @GetMapping("/notes")
    public ResponseEntity<String> listNotes() {
        return render(listHandler.handle(NoteRequest.withBody(null)));
    }

    @PutMapping("/notes/{id}")
    public ResponseEntity<String> updateNote(
            @PathVariable String id,
            @RequestBody(required = false) String body
    ) {
        return render(updateHandler.handle(NoteRequest.forNote(id, body)));
    }

    @DeleteMapping("/notes/{id}")
    public ResponseEntity<String> deleteNote(@PathVariable String id) {
        return render(deleteHandler.handle(NoteRequest.forNote(id, null)));
    }

    private ResponseEntity<String> render(NoteResponse response) {
        HttpHeaders headers = new HttpHeaders();
        response.headers().forEach(headers::set);
        return ResponseEntity.status(response.statusCode())
                .headers(headers)
                .body(response.body());
    }
}
