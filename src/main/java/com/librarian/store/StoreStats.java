package com.librarian.store;

import java.nio.file.Path;

public record StoreStats(int chunkCount, int bookCount, Path storePath) {
    public boolean isEmpty() {
        return chunkCount == 0;
    }
}
