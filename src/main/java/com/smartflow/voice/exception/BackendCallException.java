package com.smartflow.voice.exception;

import lombok.Getter;

/**
 * Failure of an actual call to a backend (primary, secondary, health probe or wake).
 * Counted toward the owning breaker's failure state.
 */
@Getter
public class BackendCallException extends RuntimeException {

    private final String backend;

    public BackendCallException(String backend, String message) {
        super(message);
        this.backend = backend;
    }

    public BackendCallException(String backend, String message, Throwable cause) {
        super(message, cause);
        this.backend = backend;
    }
}
