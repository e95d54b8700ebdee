package com.adlanda.queryagent.service;

import com.adlanda.queryagent.exception.EmbeddingDimensionMismatchException;
import com.adlanda.queryagent.exception.NoIndexException;
import com.adlanda.queryagent.model.EmbeddingVector;
import com.adlanda.queryagent.model.IndexHandle;
import com.adlanda.queryagent.model.RetrievedContext;
import com.adlanda.queryagent.model.ScoredChunk;
import com.adlanda.queryagent.repository.VectorIndex;
import com.adlanda.queryagent.repository.VectorMatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;

/**
 * Service responsible for retrieving relevant chunks of an indexed document.
 *
 * Orchestrates the query flow:
 * 1. Embed the query
 * 2. Search the session's collection
 * 3. Return ranked results
 */
@Service
public class RetrievalService {

    private static final Logger log = LoggerFactory.getLogger(RetrievalService.class);

    private final EmbeddingService embeddingService;
    private final VectorIndex vectorIndex;

    public RetrievalService(EmbeddingService embeddingService, VectorIndex vectorIndex) {
        this.embeddingService = embeddingService;
        this.vectorIndex = vectorIndex;
    }

    /**
     * Retrieves the chunks most similar to the query.
     *
     * @param query  The question to search for
     * @param handle Index of the session, or null if the session has none
     * @param k      Maximum number of chunks to return
     * @return Up to {@code k} chunks ordered by descending score
     * @throws NoIndexException if {@code handle} is null or its collection is gone
     * @throws EmbeddingDimensionMismatchException if the query embedding does not match the index
     */
    public RetrievedContext retrieve(String query, IndexHandle handle, int k) {
        if (k < 1) {
            throw new IllegalArgumentException("k must be at least 1, was " + k);
        }
        if (handle == null) {
            throw new NoIndexException();
        }

        long startTime = System.currentTimeMillis();

        // 1. Embed the query
        EmbeddingVector queryVector = embeddingService.embed(query);
        if (queryVector.dimension() != handle.dimension()) {
            throw new EmbeddingDimensionMismatchException(handle.dimension(), queryVector.dimension());
        }

        // 2. Search the session's collection
        List<VectorMatch> matches = vectorIndex.search(handle.collectionId(), queryVector, k);

        // 3. Convert to results
        List<ScoredChunk> results = matches.stream()
                .map(match -> new ScoredChunk(match.payload(), match.score()))
                .sorted(Comparator.comparingDouble(ScoredChunk::score).reversed())
                .limit(k)
                .toList();

        log.debug("Query '{}' returned {} chunks from session {} in {}ms",
                truncate(query, 50), results.size(), handle.sessionId(), System.currentTimeMillis() - startTime);

        return new RetrievedContext(results);
    }

    private String truncate(String s, int maxLen) {
        return s.length() <= maxLen ? s : s.substring(0, maxLen) + "...";
    }
}
