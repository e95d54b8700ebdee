package com.adlanda.queryagent.exception;

/**
 * Thrown when retrieval is requested for a session that has no indexed document.
 */
public class NoIndexException extends AgentException {

    public NoIndexException() {
        super(ErrorKind.NO_INDEX, "No document is indexed for this session");
    }

    public NoIndexException(String sessionId) {
        super(ErrorKind.NO_INDEX, "No document is indexed for session '" + sessionId + "'");
    }
}
