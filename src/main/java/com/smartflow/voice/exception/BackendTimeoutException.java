package com.smartflow.voice.exception;

import lombok.Getter;

import java.time.Duration;

/**
 * A backend call exceeded its upper-bound timeout.
 */
@Getter
public class BackendTimeoutException extends BackendCallException {

    private final Duration timeout;

    public BackendTimeoutException(String backend, Duration timeout, Throwable cause) {
        super(backend, backend + " did not answer within " + timeout.toMillis() + "ms", cause);
        this.timeout = timeout;
    }
}
