package com.adlanda.queryagent.model;

import java.util.Arrays;

/**
 * Fixed-length vector representation of a piece of text.
 */
public record EmbeddingVector(float[] values) {

    public EmbeddingVector {
        if (values == null || values.length == 0) {
            throw new IllegalArgumentException("Embedding vector must not be empty");
        }
    }

    public int dimension() {
        return values.length;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof EmbeddingVector other && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "EmbeddingVector[dimension=" + values.length + "]";
    }
}
