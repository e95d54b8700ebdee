package com.adlanda.queryagent.repository;

import java.util.List;

import com.adlanda.queryagent.model.EmbeddingVector;

/**
 * Contract the agent requires of a vector store.
 *
 * A collection holds the embedded chunks of one document. All vectors in a
 * collection share one dimension.
 */
public interface VectorIndex {

    /**
     * Adds or replaces the whole content of a collection in one operation.
     *
     * Searches running concurrently observe either the previous content or the
     * new content, never a mix of both.
     *
     * @param collectionId target collection; created if absent
     * @param points       points to store (non-empty, one dimension)
     * @throws com.adlanda.queryagent.exception.EmbeddingDimensionMismatchException if the points disagree on dimension
     */
    void upsert(String collectionId, List<VectorPoint> points);

    /**
     * Returns up to {@code k} matches ordered by descending similarity.
     *
     * @throws com.adlanda.queryagent.exception.NoIndexException if the collection does not exist
     * @throws com.adlanda.queryagent.exception.EmbeddingDimensionMismatchException if the query dimension differs from the collection's
     */
    List<VectorMatch> search(String collectionId, EmbeddingVector vector, int k);

    /**
     * Drops a collection. Returns true if it existed.
     */
    boolean delete(String collectionId);

    /**
     * Returns the number of points in a collection, or 0 if it does not exist.
     */
    int count(String collectionId);
}
