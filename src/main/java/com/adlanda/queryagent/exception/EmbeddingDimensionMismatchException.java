package com.adlanda.queryagent.exception;

public class EmbeddingDimensionMismatchException extends AgentException {

    public EmbeddingDimensionMismatchException(int expected, int actual) {
        super(ErrorKind.EMBEDDING_DIMENSION_MISMATCH,
                "Embedding dimension mismatch: expected " + expected + " but got " + actual);
    }
}
