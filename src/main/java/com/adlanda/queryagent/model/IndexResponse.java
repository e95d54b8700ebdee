package com.adlanda.queryagent.model;

import java.time.Instant;

/**
 * Summary of a published session index.
 */
public record IndexResponse(
        String sessionId,
        String collectionId,
        long generation,
        int chunkCount,
        int dimension,
        Instant indexedAt
) {
    public static IndexResponse from(IndexHandle handle) {
        return new IndexResponse(
                handle.sessionId(),
                handle.collectionId(),
                handle.generation(),
                handle.chunkCount(),
                handle.dimension(),
                handle.indexedAt()
        );
    }
}
