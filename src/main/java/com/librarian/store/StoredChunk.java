package com.librarian.store;

public record StoredChunk(
        String id,
        String documentId,
        int sequenceIndex,
        int totalChunks,
        String text,
        BookMetadata metadata,
        float[] embedding,
        String embeddingVersion) {
}
