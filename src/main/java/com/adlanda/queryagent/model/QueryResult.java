package com.adlanda.queryagent.model;

/**
 * A retrieved chunk as reported to the caller.
 *
 * @param chunkId   Stable identifier of the chunk
 * @param content   The text content of the chunk
 * @param position  Position of this chunk within the document
 * @param score     Cosine similarity score (higher is more similar)
 */
public record QueryResult(
        String chunkId,
        String content,
        int position,
        double score
) {
    public static QueryResult from(ScoredChunk scored) {
        Chunk chunk = scored.chunk();
        return new QueryResult(chunk.id(), chunk.content(), chunk.position(), scored.score());
    }
}
