package com.librarian.store;

import java.util.Locale;
import java.util.regex.Pattern;

public class LocalEmbeddingService implements EmbeddingService {
    private static final String VERSION_PREFIX = "local-hash-v2-";
    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}]+");
    private static final float WORD_WEIGHT = 1.0f;
    private static final float PAIR_WEIGHT = 0.5f;
    private static final float TRIGRAM_WEIGHT = 0.35f;

    private final int dimension;

    public LocalEmbeddingService(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be positive");
        }
        this.dimension = dimension;
    }

    @Override
    public float[] embed(String text) {
        float[] vector = new float[dimension];
        if (text == null || text.isBlank()) {
            return vector;
        }

        String previous = null;
        for (String word : NON_WORD.split(text.toLowerCase(Locale.ROOT))) {
            if (word.isEmpty()) {
                continue;
            }
            add(vector, "w:" + word, WORD_WEIGHT);
            for (int i = 0; i + 3 <= word.length(); i++) {
                add(vector, "t:" + word.substring(i, i + 3), TRIGRAM_WEIGHT);
            }
            if (previous != null) {
                add(vector, "p:" + previous + ' ' + word, PAIR_WEIGHT);
            }
            previous = word;
        }

        scaleToUnitLength(vector);
        return vector;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public String version() {
        return VERSION_PREFIX + dimension;
    }

    private static void add(float[] vector, String feature, float weight) {
        vector[Math.floorMod(feature.hashCode(), vector.length)] += weight;
    }

    private static void scaleToUnitLength(float[] vector) {
        double sumOfSquares = 0d;
        for (float value : vector) {
            sumOfSquares += value * value;
        }
        if (sumOfSquares == 0d) {
            return;
        }
        float length = (float) Math.sqrt(sumOfSquares);
        for (int i = 0; i < vector.length; i++) {
            vector[i] /= length;
        }
    }
}
