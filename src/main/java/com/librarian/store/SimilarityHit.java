package com.librarian.store;

public record SimilarityHit(String chunkId, BookMetadata metadata, String text, double distance) {
}
