package com.librarian.ingest;

public record ChunkSpan(int start, int end) {
    public int length() {
        return end - start;
    }
}
