package com.smartflow.voice.provider;

import com.smartflow.voice.model.BackendHealthSnapshot;
import reactor.core.publisher.Mono;

/**
 * Health probing and waking of the scale-to-zero compute backend.
 */
public interface ComputeBackendClient {

    /**
     * Probe the backend once. Never errors: failures are classified into the snapshot status.
     */
    Mono<BackendHealthSnapshot> probe();

    /**
     * Ask the backend to start. Completes empty once the wake request was accepted and errors
     * when it was not.
     */
    Mono<Void> wake();
}
