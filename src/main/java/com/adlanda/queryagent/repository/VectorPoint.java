package com.adlanda.queryagent.repository;

import com.adlanda.queryagent.model.Chunk;
import com.adlanda.queryagent.model.EmbeddingVector;

/**
 * An embedded chunk as written to a vector index collection.
 */
public record VectorPoint(String id, EmbeddingVector vector, Chunk payload) {

    public static VectorPoint of(Chunk chunk, EmbeddingVector vector) {
        return new VectorPoint(chunk.id(), vector, chunk);
    }
}
