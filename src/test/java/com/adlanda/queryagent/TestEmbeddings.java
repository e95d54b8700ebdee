package com.adlanda.queryagent;

import com.adlanda.queryagent.model.EmbeddingVector;
import com.adlanda.queryagent.service.EmbeddingService;

import java.util.Locale;

/**
 * Deterministic stand-ins for the embedding model.
 */
public final class TestEmbeddings {

    private TestEmbeddings() {
    }

    /**
     * Bag-of-words embedding: each lower-cased word adds 1 to a hashed bucket.
     * Texts sharing words score higher, identical texts score 1.0. Thread-safe.
     */
    public static EmbeddingService bagOfWords(int dimension) {
        return new EmbeddingService(null) {
            @Override
            public EmbeddingVector embed(String text) {
                return new EmbeddingVector(vectorFor(text, dimension));
            }
        };
    }

    /**
     * Always returns vectors of the given dimension, whatever the text.
     */
    public static EmbeddingService fixedDimension(int dimension) {
        return new EmbeddingService(null) {
            @Override
            public EmbeddingVector embed(String text) {
                float[] values = new float[dimension];
                values[0] = 1.0f;
                return new EmbeddingVector(values);
            }
        };
    }

    public static float[] vectorFor(String text, int dimension) {
        float[] values = new float[dimension];
        for (String word : text.toLowerCase(Locale.ROOT).split("[^\\p{L}0-9]+")) {
            if (!word.isEmpty()) {
                values[Math.floorMod(word.hashCode(), dimension)] += 1.0f;
            }
        }
        // keep the vector non-zero so cosine similarity is defined
        values[dimension - 1] += 0.01f;
        return values;
    }
}
