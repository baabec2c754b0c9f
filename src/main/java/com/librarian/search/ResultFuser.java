package com.librarian.search;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import com.librarian.store.BookMetadata;
import com.librarian.store.SimilarityHit;

/**
 * Collapses chunk-level similarity hits into one ranked entry per book.
 * <p>
 * A book's relevance is the score of its best chunk ({@code 1 - distance}), not an average, so one strongly
 * matching passage is enough to surface it. Callers over-fetch hits because several chunks of one book compete
 * for the same slots.
 */
public class ResultFuser {
    public static final int DEFAULT_EXCERPT_LENGTH = 300;
    public static final String ELLIPSIS = "...";

    private static final Pattern CHUNK_SUFFIX = Pattern.compile("_chunk_\\d+$");

    private final int excerptLength;

    public ResultFuser() {
        this(DEFAULT_EXCERPT_LENGTH);
    }

    public ResultFuser(int excerptLength) {
        if (excerptLength <= 0) {
            throw new IllegalArgumentException("excerptLength must be positive");
        }
        this.excerptLength = excerptLength;
    }

    public List<RankedBook> fuse(List<SimilarityHit> hits, int limit) {
        if (hits == null || hits.isEmpty() || limit <= 0) {
            return List.of();
        }

        Map<String, Group> groups = new LinkedHashMap<>();
        for (SimilarityHit hit : hits) {
            String documentId = documentIdOf(hit.chunkId());
            groups.computeIfAbsent(documentId, id -> new Group(id, hit.metadata())).add(hit);
        }

        // List.sort is stable: equal relevance keeps first-seen order
        List<Group> ranked = new ArrayList<>(groups.values());
        ranked.sort(Comparator.comparingDouble(Group::relevance).reversed());

        return ranked.stream()
                .limit(limit)
                .map(this::toRankedBook)
                .toList();
    }

    public static String documentIdOf(String chunkId) {
        return CHUNK_SUFFIX.matcher(chunkId).replaceFirst("");
    }

    String excerpt(String text) {
        if (text.length() <= excerptLength) {
            return text;
        }
        return text.substring(0, excerptLength) + ELLIPSIS;
    }

    private RankedBook toRankedBook(Group group) {
        List<MatchedChunk> matched = new ArrayList<>(group.matches);
        matched.sort(Comparator.comparingDouble(MatchedChunk::score).reversed());
        BookMetadata metadata = group.metadata;
        return new RankedBook(
                group.documentId,
                metadata.title(),
                metadata.author(),
                metadata.filename(),
                metadata.format(),
                metadata.length(),
                group.best.score(),
                excerpt(group.best.text()),
                List.copyOf(matched));
    }

    private static final class Group {
        private final String documentId;
        private final BookMetadata metadata;
        private final List<MatchedChunk> matches = new ArrayList<>();
        private MatchedChunk best;

        private Group(String documentId, BookMetadata metadata) {
            this.documentId = documentId;
            this.metadata = metadata;
        }

        private void add(SimilarityHit hit) {
            MatchedChunk match = new MatchedChunk(hit.chunkId(), hit.text(), 1d - hit.distance());
            matches.add(match);
            if (best == null || match.score() > best.score()) {
                best = match;
            }
        }

        private double relevance() {
            return best.score();
        }
    }
}
