package com.librarian.runtime;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

@JsonIgnoreProperties(ignoreUnknown = true)
public class LibrarianConfig {
    private StoreConfig store = new StoreConfig();
    private ChunkingConfig chunking = new ChunkingConfig();
    private SearchConfig search = new SearchConfig();
    private BackgroundConfig background = new BackgroundConfig();
    private EmbeddingConfig embedding = new EmbeddingConfig();

    /** Reads {@code path}, or returns defaults when the file does not exist. */
    public static LibrarianConfig load(Path path) throws IOException {
        if (path == null || !Files.exists(path) || Files.size(path) == 0L) {
            return new LibrarianConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        LibrarianConfig config = mapper.readValue(path.toFile(), LibrarianConfig.class);
        return config == null ? new LibrarianConfig() : config;
    }

    /** {@code 0} or negative means no bound. */
    static Duration boundOrNull(long millis) {
        return millis <= 0 ? null : Duration.ofMillis(millis);
    }

    public StoreConfig getStore() {
        return store;
    }

    public void setStore(StoreConfig store) {
        this.store = store == null ? new StoreConfig() : store;
    }

    public ChunkingConfig getChunking() {
        return chunking;
    }

    public void setChunking(ChunkingConfig chunking) {
        this.chunking = chunking == null ? new ChunkingConfig() : chunking;
    }

    public SearchConfig getSearch() {
        return search;
    }

    public void setSearch(SearchConfig search) {
        this.search = search == null ? new SearchConfig() : search;
    }

    public BackgroundConfig getBackground() {
        return background;
    }

    public void setBackground(BackgroundConfig background) {
        this.background = background == null ? new BackgroundConfig() : background;
    }

    public EmbeddingConfig getEmbedding() {
        return embedding;
    }

    public void setEmbedding(EmbeddingConfig embedding) {
        this.embedding = embedding == null ? new EmbeddingConfig() : embedding;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StoreConfig {
        private String path = "./library_db";
        private long lockPollIntervalMs = 500;
        private long lockTimeoutMs = 0;
        private long interactiveLockTimeoutMs = 5000;

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public long getLockPollIntervalMs() {
            return lockPollIntervalMs;
        }

        public void setLockPollIntervalMs(long lockPollIntervalMs) {
            this.lockPollIntervalMs = lockPollIntervalMs;
        }

        public long getLockTimeoutMs() {
            return lockTimeoutMs;
        }

        public void setLockTimeoutMs(long lockTimeoutMs) {
            this.lockTimeoutMs = lockTimeoutMs;
        }

        public long getInteractiveLockTimeoutMs() {
            return interactiveLockTimeoutMs;
        }

        public void setInteractiveLockTimeoutMs(long interactiveLockTimeoutMs) {
            this.interactiveLockTimeoutMs = interactiveLockTimeoutMs;
        }

        public Duration lockPollInterval() {
            return Duration.ofMillis(Math.max(1L, lockPollIntervalMs));
        }

        /** Bound for batch work; {@code null} waits indefinitely. */
        public Duration lockTimeout() {
            return boundOrNull(lockTimeoutMs);
        }

        /** Bound for REPL commands; {@code null} waits indefinitely. */
        public Duration interactiveLockTimeout() {
            return boundOrNull(interactiveLockTimeoutMs);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ChunkingConfig {
        private int chunkSize = 1000;
        private int overlap = 200;

        public int getChunkSize() {
            return chunkSize;
        }

        public void setChunkSize(int chunkSize) {
            this.chunkSize = chunkSize;
        }

        public int getOverlap() {
            return overlap;
        }

        public void setOverlap(int overlap) {
            this.overlap = overlap;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SearchConfig {
        private int defaultLimit = 5;
        private int overFetchFactor = 3;
        private int excerptLength = 300;

        public int getDefaultLimit() {
            return defaultLimit;
        }

        public void setDefaultLimit(int defaultLimit) {
            this.defaultLimit = defaultLimit;
        }

        public int getOverFetchFactor() {
            return overFetchFactor;
        }

        public void setOverFetchFactor(int overFetchFactor) {
            this.overFetchFactor = overFetchFactor;
        }

        public int getExcerptLength() {
            return excerptLength;
        }

        public void setExcerptLength(int excerptLength) {
            this.excerptLength = excerptLength;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class BackgroundConfig {
        private long stopGraceMs = 2000;

        public long getStopGraceMs() {
            return stopGraceMs;
        }

        public void setStopGraceMs(long stopGraceMs) {
            this.stopGraceMs = stopGraceMs;
        }

        public Duration stopGrace() {
            return Duration.ofMillis(Math.max(0L, stopGraceMs));
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EmbeddingConfig {
        private int dimension = 384;

        public int getDimension() {
            return dimension;
        }

        public void setDimension(int dimension) {
            this.dimension = dimension;
        }
    }
}
