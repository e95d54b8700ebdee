package com.adlanda.queryagent.exception;

/**
 * Thrown when a document with no indexable content is submitted.
 */
public class EmptyDocumentException extends AgentException {

    public EmptyDocumentException(String sessionId) {
        super(ErrorKind.EMPTY_DOCUMENT, "Document for session '" + sessionId + "' has no content to index");
    }
}
