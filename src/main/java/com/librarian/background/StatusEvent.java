package com.librarian.background;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonIgnore;

import com.librarian.ingest.IndexingStats;

public record StatusEvent(StatusPhase phase, String message, IndexingStats stats, String error, Instant emittedAt) {

    public static StatusEvent starting(String message) {
        return new StatusEvent(StatusPhase.STARTING, message, null, null, Instant.now());
    }

    public static StatusEvent running(String message) {
        return new StatusEvent(StatusPhase.RUNNING, message, null, null, Instant.now());
    }

    public static StatusEvent completed(IndexingStats stats) {
        return new StatusEvent(StatusPhase.COMPLETED, "Indexing completed successfully!", stats, null, Instant.now());
    }

    public static StatusEvent interrupted(IndexingStats stats) {
        return new StatusEvent(StatusPhase.INTERRUPTED, "Indexing was interrupted", stats, null, Instant.now());
    }

    public static StatusEvent error(String message, String error) {
        return new StatusEvent(StatusPhase.ERROR, message, null, error, Instant.now());
    }

    @JsonIgnore
    public boolean isTerminal() {
        return phase.isTerminal();
    }
}
