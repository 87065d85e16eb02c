package com.smartflow.voice.resilience;

/**
 * Observer of circuit breaker state transitions.
 * Called outside the breaker's lock; exceptions are logged and ignored by the breaker.
 */
@FunctionalInterface
public interface CircuitStateListener {

    void onStateChange(CircuitTransitionEvent event);
}
