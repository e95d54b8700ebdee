package com.adlanda.queryagent.service;

import com.adlanda.queryagent.exception.UpstreamCapabilityException;
import com.adlanda.queryagent.model.Chunk;
import com.adlanda.queryagent.model.EmbeddingVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.embedding.EmbeddingResponse;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Service responsible for generating vector embeddings from text.
 *
 * Uses Spring AI's EmbeddingModel. The same instance embeds document chunks at
 * indexing time and queries at retrieval time.
 */
@Service
public class EmbeddingService {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingService.class);

    private final EmbeddingModel embeddingModel;

    public EmbeddingService(EmbeddingModel embeddingModel) {
        this.embeddingModel = embeddingModel;
    }

    /**
     * Generates an embedding vector for the given text.
     *
     * @param text The text to embed
     * @return The embedding
     * @throws UpstreamCapabilityException if the embedding model fails or returns nothing
     */
    public EmbeddingVector embed(String text) {
        EmbeddingResponse response;
        try {
            response = embeddingModel.embedForResponse(List.of(text));
        } catch (RuntimeException e) {
            throw new UpstreamCapabilityException("embedding", e);
        }

        if (response == null || response.getResult() == null) {
            throw new UpstreamCapabilityException("embedding", "model returned no embedding");
        }
        float[] output = response.getResult().getOutput();
        if (output == null || output.length == 0) {
            throw new UpstreamCapabilityException("embedding", "model returned an empty embedding");
        }
        return new EmbeddingVector(output);
    }

    /**
     * Embeds each chunk, preserving order.
     */
    public List<EmbeddingVector> embedChunks(List<Chunk> chunks) {
        log.info("Generating embeddings for {} chunks...", chunks.size());

        List<EmbeddingVector> vectors = chunks.stream()
                .map(chunk -> embed(chunk.content()))
                .toList();

        log.info("Generated {} embeddings", vectors.size());
        return vectors;
    }
}
