package com.adlanda.queryagent.exception;

/**
 * Failure categories a query cycle or an indexing request can end with.
 */
public enum ErrorKind {
    EMPTY_DOCUMENT,
    NO_INDEX,
    UNROUTABLE_QUERY,
    LOCATION_NOT_FOUND,
    EMBEDDING_DIMENSION_MISMATCH,
    UPSTREAM_CAPABILITY,
    UNSUPPORTED_DOCUMENT,
    INTERNAL
}
