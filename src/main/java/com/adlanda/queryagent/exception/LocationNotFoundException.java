package com.adlanda.queryagent.exception;

/**
 * Thrown when a weather query names no location, or names one the provider does not know.
 */
public class LocationNotFoundException extends AgentException {

    public LocationNotFoundException(String message) {
        super(ErrorKind.LOCATION_NOT_FOUND, message);
    }
}
