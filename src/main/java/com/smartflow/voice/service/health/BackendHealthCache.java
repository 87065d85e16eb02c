package com.smartflow.voice.service.health;

import com.smartflow.voice.config.SmartflowProperties;
import com.smartflow.voice.exception.BackendTimeoutException;
import com.smartflow.voice.model.BackendHealthSnapshot;
import com.smartflow.voice.model.BackendStatus;
import com.smartflow.voice.model.dto.ComputeStatus;
import com.smartflow.voice.provider.ComputeBackendClient;
import com.smartflow.voice.resilience.CircuitBreaker;
import com.smartflow.voice.resilience.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Cached view of the scale-to-zero compute backend's health, with wake-on-demand.
 *
 * <p>At most one probe and at most one wake are in flight at a time; concurrent callers join
 * the running one. Failed probes are cached like successful ones, so a dead backend is probed
 * at most once per health-cache TTL.</p>
 */
@Slf4j
@Service
public class BackendHealthCache {

    private final ComputeBackendClient client;
    private final CircuitBreaker wakeBreaker;
    private final SmartflowProperties.ComputeConfig config;
    private final Clock clock;

    private volatile BackendHealthSnapshot lastSnapshot;
    private final AtomicReference<Mono<BackendHealthSnapshot>> inFlightProbe = new AtomicReference<>();
    private final AtomicReference<Mono<Boolean>> inFlightWake = new AtomicReference<>();

    private final AtomicLong totalHealthChecks = new AtomicLong();
    private final AtomicLong totalCacheHits = new AtomicLong();
    private final AtomicLong totalWakeAttempts = new AtomicLong();
    private final AtomicLong totalWakeSuccesses = new AtomicLong();

    public BackendHealthCache(ComputeBackendClient client,
                              CircuitBreakerRegistry breakers,
                              SmartflowProperties properties,
                              Clock clock) {
        this.client = client;
        this.wakeBreaker = breakers.get(CircuitBreakerRegistry.WAKE);
        this.config = properties.getCompute();
        this.clock = clock;
    }

    /**
     * Current health. Served from cache (marked {@code cached}) while younger than the
     * health-cache TTL, unless {@code forceRefresh}.
     */
    public Mono<BackendHealthSnapshot> checkHealth(boolean forceRefresh) {
        return Mono.defer(() -> {
            BackendHealthSnapshot cached = lastSnapshot;
            if (!forceRefresh && isFresh(cached)) {
                totalCacheHits.incrementAndGet();
                return Mono.just(cached.toBuilder().cached(true).build());
            }
            return sharedProbe();
        });
    }

    /**
     * Make sure the compute backend can serve.
     *
     * @return true once HEALTHY was observed; false when unreachable or the wake did not
     * produce a healthy backend within the wake budget. Never errors.
     */
    public Mono<Boolean> ensureReady() {
        return checkHealth(false)
                .flatMap(snapshot -> {
                    switch (snapshot.getStatus()) {
                        case HEALTHY:
                            return Mono.just(true);
                        case UNREACHABLE:
                            log.debug("Compute backend unreachable, not waking: {}", snapshot.getDetail());
                            return Mono.just(false);
                        default:
                            return sharedWake();
                    }
                })
                .onErrorResume(e -> {
                    log.warn("Compute readiness check failed: {}", e.getMessage());
                    return Mono.just(false);
                });
    }

    /**
     * Drop the cached snapshot so the next check probes.
     */
    public void invalidate() {
        lastSnapshot = null;
    }

    public Optional<BackendHealthSnapshot> getLastSnapshot() {
        return Optional.ofNullable(lastSnapshot);
    }

    public ComputeStatus status() {
        BackendHealthSnapshot snapshot = lastSnapshot;
        long checks = totalHealthChecks.get();
        long hits = totalCacheHits.get();
        long wakes = totalWakeAttempts.get();
        return ComputeStatus.builder()
                .status(snapshot != null ? snapshot.getStatus() : BackendStatus.UNKNOWN)
                .totalHealthChecks(checks)
                .cacheHitRate(checks + hits > 0 ? (double) hits / (checks + hits) : 0.0)
                .wakeAttempts(wakes)
                .wakeSuccessRate(wakes > 0 ? (double) totalWakeSuccesses.get() / wakes : 0.0)
                .lastHealth(snapshot)
                .build();
    }

    private boolean isFresh(BackendHealthSnapshot snapshot) {
        return snapshot != null
                && snapshot.getObservedAt() != null
                && Duration.between(snapshot.getObservedAt(), clock.instant())
                        .compareTo(config.getHealthCacheTtl()) < 0;
    }

    private Mono<BackendHealthSnapshot> sharedProbe() {
        return joinOrStart(inFlightProbe, () -> Mono.defer(() -> {
                    totalHealthChecks.incrementAndGet();
                    return client.probe();
                })
                .onErrorResume(e -> Mono.just(BackendHealthSnapshot.builder()
                        .status(BackendStatus.UNREACHABLE)
                        .observedAt(clock.instant())
                        .detail(e.getMessage())
                        .build()))
                .doOnNext(this::record));
    }

    private void record(BackendHealthSnapshot snapshot) {
        BackendHealthSnapshot previous = lastSnapshot;
        lastSnapshot = snapshot;
        if (previous == null || previous.getStatus() != snapshot.getStatus()) {
            log.info("Compute backend status: {} ({}ms){}", snapshot.getStatus(), snapshot.getLatencyMs(),
                    snapshot.getDetail() != null ? ", " + snapshot.getDetail() : "");
        }
    }

    private Mono<Boolean> sharedWake() {
        return joinOrStart(inFlightWake, this::performWake);
    }

    /**
     * Join the call in flight or start a new one. The slot is released before the result is
     * delivered, so a caller arriving after completion never receives a finished result.
     */
    private static <T> Mono<T> joinOrStart(AtomicReference<Mono<T>> inFlight, Supplier<Mono<T>> call) {
        while (true) {
            Mono<T> running = inFlight.get();
            if (running != null) {
                return running;
            }
            AtomicReference<Mono<T>> self = new AtomicReference<>();
            Runnable release = () -> inFlight.compareAndSet(self.get(), null);
            Mono<T> shared = Mono.defer(call)
                    .doOnNext(value -> release.run())
                    .doOnTerminate(release)
                    .doOnCancel(release)
                    .cache();
            self.set(shared);
            if (inFlight.compareAndSet(null, shared)) {
                return shared;
            }
        }
    }

    /**
     * Wake request inside the wake breaker with its own deadline, then readiness polls bounded
     * by what is left of the wake budget. A timed-out wake request is a breaker failure.
     */
    private Mono<Boolean> performWake() {
        long attempt = totalWakeAttempts.incrementAndGet();
        long started = clock.millis();
        Duration requestDeadline = config.effectiveWakeRequestTimeout();
        log.info("Waking compute backend (attempt {})", attempt);

        return wakeBreaker.<Void>execute(() -> client.wake()
                        .timeout(requestDeadline)
                        .onErrorMap(TimeoutException.class,
                                e -> new BackendTimeoutException("compute", requestDeadline, e)))
                .then(Mono.defer(() -> {
                    Duration remaining = config.getWakeTimeout().minusMillis(clock.millis() - started);
                    if (remaining.isNegative() || remaining.isZero()) {
                        return Mono.just(false);
                    }
                    return pollUntilHealthy(1).timeout(remaining, Mono.just(false));
                }))
                .doOnNext(ready -> {
                    if (ready) {
                        totalWakeSuccesses.incrementAndGet();
                        log.info("Compute backend ready after wake");
                    } else {
                        log.warn("Compute backend not ready after wake");
                    }
                })
                .onErrorResume(e -> {
                    log.warn("Compute backend wake failed: {}", e.getMessage());
                    return Mono.just(false);
                });
    }

    private Mono<Boolean> pollUntilHealthy(int poll) {
        return Mono.delay(config.getWakePollInterval())
                .then(checkHealth(true))
                .flatMap(snapshot -> {
                    if (snapshot.isHealthy()) {
                        return Mono.just(true);
                    }
                    if (poll >= config.getMaxWakePolls()) {
                        return Mono.just(false);
                    }
                    log.debug("Compute backend {} after wake poll {}/{}", snapshot.getStatus(), poll,
                            config.getMaxWakePolls());
                    return pollUntilHealthy(poll + 1);
                });
    }
}
