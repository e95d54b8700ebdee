package com.adlanda.queryagent.model;

/**
 * A chunk with its similarity score.
 */
public record ScoredChunk(Chunk chunk, double score) {}
