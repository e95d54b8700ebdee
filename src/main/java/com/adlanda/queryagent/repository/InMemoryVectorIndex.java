package com.adlanda.queryagent.repository;

import com.adlanda.queryagent.exception.EmbeddingDimensionMismatchException;
import com.adlanda.queryagent.exception.NoIndexException;
import com.adlanda.queryagent.model.EmbeddingVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory vector index with exact cosine-similarity search.
 *
 * Each collection is an immutable snapshot; upsert swaps the snapshot in a
 * single map write and search reads exactly one snapshot.
 */
@Repository
public class InMemoryVectorIndex implements VectorIndex {

    private static final Logger log = LoggerFactory.getLogger(InMemoryVectorIndex.class);

    private final Map<String, Snapshot> collections = new ConcurrentHashMap<>();

    @Override
    public void upsert(String collectionId, List<VectorPoint> points) {
        if (points == null || points.isEmpty()) {
            throw new IllegalArgumentException("Cannot upsert an empty set of points");
        }

        int dimension = points.get(0).vector().dimension();
        for (VectorPoint point : points) {
            if (point.vector().dimension() != dimension) {
                throw new EmbeddingDimensionMismatchException(dimension, point.vector().dimension());
            }
        }

        collections.put(collectionId, new Snapshot(dimension, List.copyOf(points)));
        log.info("Stored {} points in collection {}", points.size(), collectionId);
    }

    @Override
    public List<VectorMatch> search(String collectionId, EmbeddingVector vector, int k) {
        if (k < 1) {
            throw new IllegalArgumentException("k must be at least 1, was " + k);
        }

        Snapshot collection = collections.get(collectionId);
        if (collection == null) {
            throw new NoIndexException(collectionId);
        }
        if (collection.dimension() != vector.dimension()) {
            throw new EmbeddingDimensionMismatchException(collection.dimension(), vector.dimension());
        }

        return collection.points().stream()
                .map(point -> new VectorMatch(point.id(), point.payload(),
                        cosineSimilarity(vector.values(), point.vector().values())))
                .sorted(Comparator.comparingDouble(VectorMatch::score).reversed())
                .limit(k)
                .toList();
    }

    @Override
    public boolean delete(String collectionId) {
        Snapshot removed = collections.remove(collectionId);
        if (removed != null) {
            log.info("Dropped collection {} ({} points)", collectionId, removed.points().size());
        }
        return removed != null;
    }

    @Override
    public int count(String collectionId) {
        Snapshot collection = collections.get(collectionId);
        return collection == null ? 0 : collection.points().size();
    }

    /**
     * Computes cosine similarity between two vectors of equal length.
     *
     * @return Similarity in [-1, 1]; 0 if either vector has zero norm
     */
    private double cosineSimilarity(float[] a, float[] b) {
        double dotProduct = 0.0;
        double normA = 0.0;
        double normB = 0.0;

        for (int i = 0; i < a.length; i++) {
            dotProduct += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }

        if (normA == 0 || normB == 0) {
            return 0.0;
        }

        return dotProduct / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    private record Snapshot(int dimension, List<VectorPoint> points) {}
}
