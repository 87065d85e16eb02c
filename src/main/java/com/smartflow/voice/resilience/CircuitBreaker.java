package com.smartflow.voice.resilience;

import com.smartflow.voice.exception.CircuitOpenException;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Failure-isolation state machine guarding the calls to one named backend.
 *
 * <p>All state lives behind a single monitor. Admission (including occupying the single
 * half-open trial slot) and outcome recording are each one critical section, so two
 * concurrent callers can never both become the half-open trial. Listeners are notified
 * after the lock is released.</p>
 */
@Slf4j
public class CircuitBreaker {

    private final String name;
    private final CircuitBreakerSettings settings;
    private final Clock clock;
    private final List<CircuitStateListener> listeners = new CopyOnWriteArrayList<>();
    private final Object lock = new Object();

    private CircuitState state = CircuitState.CLOSED;
    private final Deque<Instant> failureTimestamps = new ArrayDeque<>();
    private int failures;
    private int successes;
    private Instant lastFailureTime;
    private Instant lastSuccessTime;
    private boolean trialInFlight;

    private long totalRequests;
    private long totalFailures;
    private long totalSuccesses;
    private long openTransitions;

    private enum Permit {
        NORMAL,
        TRIAL
    }

    public CircuitBreaker(String name, CircuitBreakerSettings settings, Clock clock) {
        this.name = name;
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * Run the operation through the breaker.
     *
     * @param operation lazily supplies the backend call; not invoked when the circuit rejects
     * @return the operation's result, or an error signal carrying {@link CircuitOpenException}
     * when the call was rejected
     */
    public <T> Mono<T> execute(Supplier<? extends Mono<? extends T>> operation) {
        return Mono.<T>defer(() -> {
            Permit permit;
            try {
                permit = acquire();
            } catch (CircuitOpenException e) {
                return Mono.<T>error(e);
            }

            AtomicBoolean settled = new AtomicBoolean();
            return Mono.<T>defer(operation)
                    .doOnSuccess(value -> {
                        if (settled.compareAndSet(false, true)) {
                            onSuccess(permit);
                        }
                    })
                    .doOnError(error -> {
                        if (settled.compareAndSet(false, true)) {
                            onFailure(permit, error);
                        }
                    })
                    .doOnCancel(() -> {
                        if (settled.compareAndSet(false, true)) {
                            onCancel(permit);
                        }
                    });
        });
    }

    /**
     * Like {@link #execute(Supplier)}, but both rejections and operation failures are routed
     * to {@code fallback}, whose result becomes the overall result.
     */
    public <T> Mono<T> executeWithFallback(
            Supplier<? extends Mono<? extends T>> operation,
            Function<? super Throwable, ? extends Mono<? extends T>> fallback) {
        return this.<T>execute(operation)
                .onErrorResume(error -> {
                    if (error instanceof CircuitOpenException) {
                        log.debug("Circuit [{}] open, using fallback", name);
                    } else {
                        log.debug("Circuit [{}] call failed, using fallback: {}", name, error.getMessage());
                    }
                    return fallback.apply(error);
                });
    }

    /**
     * Whether a call made now would be admitted. Does not change state.
     */
    public boolean allowsRequests() {
        synchronized (lock) {
            switch (state) {
                case CLOSED:
                    return true;
                case OPEN:
                    return resetTimeoutElapsed(clock.instant());
                default:
                    return !trialInFlight;
            }
        }
    }

    /**
     * Admin action: back to CLOSED with an empty failure window and cleared since-reset
     * counters. Lifetime totals are kept.
     */
    public void reset() {
        CircuitTransitionEvent event;
        synchronized (lock) {
            failures = 0;
            successes = 0;
            failureTimestamps.clear();
            trialInFlight = false;
            event = transitionTo(CircuitState.CLOSED, null);
        }
        log.info("Circuit [{}] reset", name);
        publish(event);
    }

    public void addListener(CircuitStateListener listener) {
        listeners.add(listener);
    }

    public String getName() {
        return name;
    }

    public CircuitBreakerSettings getSettings() {
        return settings;
    }

    public CircuitState getState() {
        synchronized (lock) {
            return state;
        }
    }

    public boolean isOpen() {
        return getState() == CircuitState.OPEN;
    }

    public CircuitBreakerStats getStats() {
        synchronized (lock) {
            return snapshot();
        }
    }

    private Permit acquire() {
        CircuitTransitionEvent event = null;
        Permit permit;
        synchronized (lock) {
            totalRequests++;
            Instant now = clock.instant();
            pruneWindow(now);

            if (state == CircuitState.OPEN) {
                if (!resetTimeoutElapsed(now)) {
                    throw new CircuitOpenException(name, snapshot());
                }
                event = transitionTo(CircuitState.HALF_OPEN, null);
            }

            if (state == CircuitState.HALF_OPEN) {
                if (trialInFlight) {
                    throw new CircuitOpenException(name, snapshot());
                }
                trialInFlight = true;
                permit = Permit.TRIAL;
            } else {
                permit = Permit.NORMAL;
            }
        }
        publish(event);
        return permit;
    }

    private void onSuccess(Permit permit) {
        CircuitTransitionEvent event = null;
        synchronized (lock) {
            successes++;
            totalSuccesses++;
            lastSuccessTime = clock.instant();

            if (permit == Permit.TRIAL) {
                trialInFlight = false;
            }
            if (permit == Permit.TRIAL && state == CircuitState.HALF_OPEN) {
                clearFailures();
                event = transitionTo(CircuitState.CLOSED, null);
            } else if (state == CircuitState.CLOSED) {
                clearFailures();
            }
        }
        publish(event);
    }

    private void onFailure(Permit permit, Throwable error) {
        CircuitTransitionEvent event = null;
        synchronized (lock) {
            Instant now = clock.instant();
            failures++;
            totalFailures++;
            lastFailureTime = now;
            failureTimestamps.addLast(now);
            pruneWindow(now);

            if (permit == Permit.TRIAL) {
                trialInFlight = false;
            }
            if (permit == Permit.TRIAL && state == CircuitState.HALF_OPEN) {
                event = transitionTo(CircuitState.OPEN, error);
            } else if (state == CircuitState.CLOSED && activeFailures() >= settings.getFailureThreshold()) {
                event = transitionTo(CircuitState.OPEN, error);
            }
        }
        publish(event);
    }

    private void onCancel(Permit permit) {
        if (permit != Permit.TRIAL) {
            return;
        }
        synchronized (lock) {
            trialInFlight = false;
        }
        log.debug("Circuit [{}] half-open trial cancelled, slot released", name);
    }

    private int activeFailures() {
        return settings.getFailureWindow() != null ? failureTimestamps.size() : failures;
    }

    private void clearFailures() {
        failures = 0;
        failureTimestamps.clear();
    }

    private void pruneWindow(Instant now) {
        Duration window = settings.getFailureWindow();
        if (window == null) {
            return;
        }
        Instant cutoff = now.minus(window);
        while (!failureTimestamps.isEmpty() && !failureTimestamps.peekFirst().isAfter(cutoff)) {
            failureTimestamps.pollFirst();
        }
    }

    private boolean resetTimeoutElapsed(Instant now) {
        if (lastFailureTime == null) {
            return true;
        }
        return Duration.between(lastFailureTime, now).compareTo(settings.getResetTimeout()) >= 0;
    }

    private CircuitTransitionEvent transitionTo(CircuitState newState, Throwable error) {
        CircuitState previous = state;
        if (previous == newState) {
            return null;
        }
        state = newState;
        if (newState == CircuitState.OPEN) {
            openTransitions++;
        }
        return CircuitTransitionEvent.builder()
                .breakerName(name)
                .previousState(previous)
                .newState(newState)
                .error(error)
                .stats(snapshot())
                .build();
    }

    private void publish(CircuitTransitionEvent event) {
        if (event == null) {
            return;
        }
        for (CircuitStateListener listener : listeners) {
            try {
                listener.onStateChange(event);
            } catch (RuntimeException e) {
                log.warn("Circuit [{}] listener {} failed on {} -> {}",
                        name, listener.getClass().getSimpleName(),
                        event.getPreviousState(), event.getNewState(), e);
            }
        }
    }

    private CircuitBreakerStats snapshot() {
        return CircuitBreakerStats.builder()
                .name(name)
                .state(state)
                .failures(failures)
                .successes(successes)
                .lastFailureTime(lastFailureTime)
                .lastSuccessTime(lastSuccessTime)
                .totalRequests(totalRequests)
                .totalFailures(totalFailures)
                .totalSuccesses(totalSuccesses)
                .openTransitions(openTransitions)
                .build();
    }
}
