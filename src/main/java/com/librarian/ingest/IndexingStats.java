package com.librarian.ingest;

public record IndexingStats(int success, int failed, int skipped, boolean interrupted) {
    public static IndexingStats empty() {
        return new IndexingStats(0, 0, 0, false);
    }

    public int processed() {
        return success + failed + skipped;
    }
}
