package com.adlanda.queryagent.exception;

/**
 * Wraps a failure of an external collaborator (embedding model, chat model, weather provider).
 */
public class UpstreamCapabilityException extends AgentException {

    private final String capability;

    public UpstreamCapabilityException(String capability, String message) {
        super(ErrorKind.UPSTREAM_CAPABILITY, capability + " call failed: " + message);
        this.capability = capability;
    }

    public UpstreamCapabilityException(String capability, Throwable cause) {
        super(ErrorKind.UPSTREAM_CAPABILITY, capability + " call failed: " + cause.getMessage(), cause);
        this.capability = capability;
    }

    public String getCapability() {
        return capability;
    }
}
