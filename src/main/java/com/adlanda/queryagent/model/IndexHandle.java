package com.adlanda.queryagent.model;

import java.time.Instant;
import java.util.List;

/**
 * Identifies the indexed document of one session.
 *
 * A new handle with a higher generation replaces the previous one when the
 * session's document is re-indexed; handles are never merged.
 *
 * The collection id is the session id for every generation, and re-indexing
 * swaps the collection in place. A handle kept across a re-index therefore
 * searches the newer generation's chunks, which need not match {@link #chunks()}.
 * Each search still sees exactly one whole generation.
 *
 * @param sessionId     The session that owns the index
 * @param collectionId  Vector index collection holding the embedded chunks
 * @param generation    Incremented on every re-index of the session
 * @param chunks        The chunks the collection was built from, in document order
 * @param dimension     Dimension shared by every vector in the collection
 * @param indexedAt     When the collection was published
 */
public record IndexHandle(
        String sessionId,
        String collectionId,
        long generation,
        List<Chunk> chunks,
        int dimension,
        Instant indexedAt
) {
    public IndexHandle {
        chunks = List.copyOf(chunks);
    }

    public int chunkCount() {
        return chunks.size();
    }
}
