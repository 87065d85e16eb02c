package com.smartflow.voice.exception;

/**
 * Internal signal that every inference path is exhausted.
 * Never reaches the transport layer; it selects the graceful-degradation response.
 */
public class DegradedServiceException extends RuntimeException {

    public DegradedServiceException(String message) {
        super(message);
    }

    public DegradedServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
