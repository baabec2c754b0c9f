package com.librarian.store;

import java.io.IOException;
import java.util.Collection;
import java.util.List;

public interface VectorIndex {
    void upsert(StoredChunk chunk);

    boolean contains(String chunkId);

    List<SimilarityHit> nearest(float[] queryEmbedding, int count);

    Collection<StoredChunk> chunks();

    int size();

    boolean requiresReembedding(String embeddingVersion);

    void clear();

    void save() throws IOException;
}
