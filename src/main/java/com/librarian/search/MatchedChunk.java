package com.librarian.search;

public record MatchedChunk(String chunkId, String text, double score) {
}
