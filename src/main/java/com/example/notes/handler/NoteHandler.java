package com.example.notes.handler;

/**
 * One stateless note operation. Every outcome, failures included, comes back as a response;
 * handlers never retry and never call the store more than once.
 */
@FunctionalInterface
public interface NoteHandler {

    NoteResponse handle(NoteRequest request);
}
