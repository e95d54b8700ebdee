package com.adlanda.queryagent.exception;

/**
 * Base type for every failure the agent reports to its caller.
 *
 * Each subclass carries a fixed {@link ErrorKind}, so callers can branch on the
 * kind without matching on exception classes.
 */
public abstract class AgentException extends RuntimeException {

    private final ErrorKind kind;

    protected AgentException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected AgentException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
