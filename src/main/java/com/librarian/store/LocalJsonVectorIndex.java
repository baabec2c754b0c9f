package com.librarian.store;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

public class LocalJsonVectorIndex implements VectorIndex {
    private static final Logger log = LoggerFactory.getLogger(LocalJsonVectorIndex.class);

    private final Path path;
    private final Map<String, StoredChunk> chunks = new LinkedHashMap<>();
    private final ObjectMapper objectMapper = JsonMapper.builder().findAndAddModules().build();

    private LocalJsonVectorIndex(Path path) {
        this.path = path;
    }

    public static LocalJsonVectorIndex load(Path path) throws IOException {
        LocalJsonVectorIndex index = new LocalJsonVectorIndex(path);
        if (!Files.exists(path) || Files.size(path) == 0L) {
            return index;
        }
        List<StoredChunk> loaded = index.objectMapper.readValue(path.toFile(), new TypeReference<List<StoredChunk>>() {
        });
        for (StoredChunk entry : loaded) {
            index.chunks.put(entry.id(), entry);
        }
        log.debug("Loaded {} chunks from {}", index.chunks.size(), path);
        return index;
    }

    @Override
    public void upsert(StoredChunk chunk) {
        chunks.put(chunk.id(), chunk);
    }

    @Override
    public boolean contains(String chunkId) {
        return chunks.containsKey(chunkId);
    }

    @Override
    public List<SimilarityHit> nearest(float[] queryEmbedding, int count) {
        if (count <= 0 || chunks.isEmpty()) {
            return List.of();
        }
        return chunks.values().stream()
                .map(stored -> new SimilarityHit(
                        stored.id(),
                        stored.metadata(),
                        stored.text(),
                        1d - cosine(queryEmbedding, stored.embedding())))
                .sorted(Comparator.comparingDouble(SimilarityHit::distance))
                .limit(count)
                .toList();
    }

    @Override
    public Collection<StoredChunk> chunks() {
        return Collections.unmodifiableCollection(chunks.values());
    }

    @Override
    public int size() {
        return chunks.size();
    }

    @Override
    public boolean requiresReembedding(String embeddingVersion) {
        return chunks.values().stream().anyMatch(chunk -> !embeddingVersion.equals(chunk.embeddingVersion()));
    }

    @Override
    public void clear() {
        chunks.clear();
    }

    @Override
    public void save() throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        Path temp = path.resolveSibling(path.getFileName() + ".tmp");
        objectMapper.writeValue(temp.toFile(), chunks.values());
        try {
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static float cosine(float[] a, float[] b) {
        if (a.length != b.length) {
            return 0f;
        }
        float dot = 0f;
        float aNorm = 0f;
        float bNorm = 0f;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            aNorm += a[i] * a[i];
            bNorm += b[i] * b[i];
        }
        if (aNorm == 0f || bNorm == 0f) {
            return 0f;
        }
        return (float) (dot / Math.sqrt(aNorm * bNorm));
    }
}
