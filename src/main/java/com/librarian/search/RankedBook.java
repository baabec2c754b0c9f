package com.librarian.search;

import java.util.List;

public record RankedBook(
        String documentId,
        String title,
        String author,
        String filename,
        String format,
        int length,
        double relevanceScore,
        String bestMatchExcerpt,
        List<MatchedChunk> allMatchedChunks) {
}
