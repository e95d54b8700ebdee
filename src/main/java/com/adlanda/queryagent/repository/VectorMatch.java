package com.adlanda.queryagent.repository;

import com.adlanda.queryagent.model.Chunk;

/**
 * A search hit: point id, stored payload and similarity score.
 */
public record VectorMatch(String id, Chunk payload, double score) {}
