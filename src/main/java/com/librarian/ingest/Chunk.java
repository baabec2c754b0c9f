package com.librarian.ingest;

public record Chunk(String documentId, int sequenceIndex, int totalChunks, String text) {
    public static final String ID_SEPARATOR = "_chunk_";

    public String id() {
        return idFor(documentId, sequenceIndex);
    }

    public static String idFor(String documentId, int sequenceIndex) {
        return documentId + ID_SEPARATOR + sequenceIndex;
    }
}
