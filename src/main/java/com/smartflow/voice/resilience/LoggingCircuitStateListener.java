package com.smartflow.voice.resilience;

import lombok.extern.slf4j.Slf4j;

/**
 * Writes every circuit transition to the application log.
 */
@Slf4j
public class LoggingCircuitStateListener implements CircuitStateListener {

    @Override
    public void onStateChange(CircuitTransitionEvent event) {
        CircuitBreakerStats stats = event.getStats();
        if (event.getNewState() == CircuitState.OPEN) {
            log.warn("Circuit [{}] {} -> {} after {} failures ({}), total opens={}",
                    event.getBreakerName(),
                    event.getPreviousState(),
                    event.getNewState(),
                    stats.getFailures(),
                    event.getError() != null ? event.getError().getMessage() : "no error",
                    stats.getOpenTransitions());
        } else {
            log.info("Circuit [{}] {} -> {}",
                    event.getBreakerName(), event.getPreviousState(), event.getNewState());
        }
    }
}
