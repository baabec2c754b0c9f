package com.librarian.ingest;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits text into overlapping character windows, preferring to end a window at a sentence boundary in its back
 * half.
 */
public class Chunker {
    public static final int DEFAULT_CHUNK_SIZE = 1000;
    public static final int DEFAULT_OVERLAP = 200;

    private static final String[] SENTENCE_BOUNDARIES = { ". ", "? ", "! " };

    private final int chunkSize;
    private final int overlap;

    public Chunker() {
        this(DEFAULT_CHUNK_SIZE, DEFAULT_OVERLAP);
    }

    public Chunker(int chunkSize, int overlap) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive");
        }
        if (overlap < 0) {
            throw new IllegalArgumentException("overlap must not be negative");
        }
        this.chunkSize = chunkSize;
        this.overlap = overlap;
    }

    public List<ChunkSpan> spans(String text) {
        List<ChunkSpan> spans = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return spans;
        }

        int length = text.length();
        int start = 0;
        while (start < length) {
            int end = Math.min(length, start + chunkSize);
            if (end < length) {
                int boundary = lastSentenceBoundary(text, start, end);
                if (boundary >= 0 && boundary - start >= chunkSize / 2) {
                    end = boundary + 1;
                }
            }
            spans.add(new ChunkSpan(start, end));
            if (end == length) {
                break;
            }
            start = Math.max(end - overlap, start + 1);
        }
        return spans;
    }

    public List<String> split(String text) {
        List<String> chunks = new ArrayList<>();
        for (ChunkSpan span : spans(text)) {
            String chunk = text.substring(span.start(), span.end()).strip();
            if (!chunk.isEmpty()) {
                chunks.add(chunk);
            }
        }
        return chunks;
    }

    public List<Chunk> chunk(Document document) {
        List<String> texts = split(document.text());
        List<Chunk> chunks = new ArrayList<>(texts.size());
        for (int i = 0; i < texts.size(); i++) {
            chunks.add(new Chunk(document.id(), i, texts.size(), texts.get(i)));
        }
        return chunks;
    }

    public int chunkSize() {
        return chunkSize;
    }

    public int overlap() {
        return overlap;
    }

    // index of the terminator character of the last boundary inside [start, end), or -1
    private static int lastSentenceBoundary(String text, int start, int end) {
        int best = -1;
        for (String boundary : SENTENCE_BOUNDARIES) {
            int found = text.lastIndexOf(boundary, end - boundary.length());
            if (found >= start && found > best) {
                best = found;
            }
        }
        return best;
    }
}
