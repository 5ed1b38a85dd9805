package com.z254.genesis.hive.routing;

import com.z254.genesis.hive.config.HiveProperties;
import com.z254.genesis.hive.observability.HiveMetrics;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.core.IntervalFunction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Per-instance circuit breakers backed by Resilience4j.
 * <p>
 * Resilience4j owns the state machine: the open-state wait, the single permitted half-open call
 * and the exponential extension of the cool-down after a failed trial. This class adds the
 * rolling time-window failure count that trips a closed circuit, and serializes all accounting
 * for one instance under that instance's tracker lock.
 */
@Component
@Slf4j
public class CircuitBreakerManager {

    private static final String NAME_PREFIX = "hive-instance-";

    private final CircuitBreakerRegistry breakerRegistry;
    private final HiveProperties.RouterProperties config;
    private final HiveMetrics metrics;
    private final Clock clock;
    private final CircuitBreakerConfig breakerConfig;
    private final IntervalFunction coolDownFunction;
    private final Map<String, Tracker> trackers = new ConcurrentHashMap<>();

    public CircuitBreakerManager(CircuitBreakerRegistry breakerRegistry, HiveProperties hiveProperties,
                                 HiveMetrics metrics, Clock clock) {
        this.breakerRegistry = breakerRegistry;
        this.config = hiveProperties.getRouter();
        this.metrics = metrics;
        this.clock = clock;

        int threshold = Math.max(1, config.getFailureThreshold());
        this.coolDownFunction = IntervalFunction.ofExponentialBackoff(
                config.getCoolDown(), config.getCoolDownMultiplier(), config.getMaxCoolDown());
        this.breakerConfig = CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(threshold)
                .minimumNumberOfCalls(threshold)
                .failureRateThreshold(100.0f)
                .permittedNumberOfCallsInHalfOpenState(1)
                .automaticTransitionFromOpenToHalfOpenEnabled(false)
                .waitIntervalFunctionInOpenState(coolDownFunction)
                .writableStackTraceEnabled(false)
                .build();

        log.info("Circuit breakers: threshold={} within {}, coolDown={} x{} (max {})",
                threshold, config.getFailureWindow(), config.getCoolDown(),
                config.getCoolDownMultiplier(), config.getMaxCoolDown());
    }

    /**
     * Ask to send one call to an instance. Always granted while closed, never while open before
     * the cool-down deadline, and exactly once after it (the half-open trial).
     */
    public boolean tryAcquire(String instanceId) {
        Tracker tracker = tracker(instanceId);
        synchronized (tracker) {
            return tracker.breaker.tryAcquirePermission();
        }
    }

    /**
     * Return a permission whose call was cancelled before producing an outcome.
     */
    public void release(String instanceId) {
        Tracker tracker = trackers.get(instanceId);
        if (tracker == null) {
            return;
        }
        synchronized (tracker) {
            tracker.breaker.releasePermission();
        }
    }

    public void recordSuccess(String instanceId, Duration elapsed) {
        Tracker tracker = tracker(instanceId);
        synchronized (tracker) {
            tracker.breaker.onSuccess(elapsed.toNanos(), TimeUnit.NANOSECONDS);
        }
    }

    public void recordFailure(String instanceId, Duration elapsed, Throwable cause) {
        Tracker tracker = tracker(instanceId);
        synchronized (tracker) {
            tracker.breaker.onError(elapsed.toNanos(), TimeUnit.NANOSECONDS, cause);
            int failures = tracker.recordFailure(clock.instant(), config.getFailureWindow());
            if (tracker.breaker.getState() == CircuitBreaker.State.CLOSED
                    && failures >= config.getFailureThreshold()) {
                tracker.breaker.transitionToOpenState();
            }
        }
    }

    public CircuitState state(String instanceId) {
        Tracker tracker = trackers.get(instanceId);
        if (tracker == null) {
            return CircuitState.builder()
                    .instanceId(instanceId)
                    .phase(CircuitPhase.CLOSED)
                    .build();
        }
        synchronized (tracker) {
            return tracker.snapshot(clock.instant(), config.getFailureWindow());
        }
    }

    public List<CircuitState> states() {
        return trackers.keySet().stream()
                .map(this::state)
                .sorted(Comparator.comparing(CircuitState::getInstanceId))
                .toList();
    }

    public long openCount() {
        return states().stream().filter(s -> s.getPhase() == CircuitPhase.OPEN).count();
    }

    /**
     * Drop all circuit state of an instance that left the registry.
     */
    public void forget(String instanceId) {
        if (trackers.remove(instanceId) != null) {
            breakerRegistry.remove(NAME_PREFIX + instanceId);
            log.debug("Discarded circuit of {}", instanceId);
        }
    }

    private Tracker tracker(String instanceId) {
        return trackers.computeIfAbsent(instanceId, id -> {
            CircuitBreaker breaker = breakerRegistry.circuitBreaker(NAME_PREFIX + id, breakerConfig);
            Tracker tracker = new Tracker(id, breaker);
            breaker.getEventPublisher().onStateTransition(event ->
                    onTransition(tracker, event.getStateTransition().getToState()));
            return tracker;
        });
    }

    private void onTransition(Tracker tracker, CircuitBreaker.State to) {
        synchronized (tracker) {
            switch (to) {
                case OPEN -> {
                    tracker.openAttempts++;
                    Duration coolDown = Duration.ofMillis(coolDownFunction.apply(tracker.openAttempts));
                    tracker.openUntil = clock.instant().plus(coolDown);
                    log.warn("Circuit of {} opened (attempt {}), cool-down {}",
                            tracker.instanceId, tracker.openAttempts, coolDown);
                }
                case HALF_OPEN -> log.info("Circuit of {} half-open, admitting one trial call", tracker.instanceId);
                case CLOSED -> {
                    tracker.failures.clear();
                    tracker.openAttempts = 0;
                    tracker.openUntil = null;
                    log.info("Circuit of {} closed", tracker.instanceId);
                }
                default -> log.debug("Circuit of {} moved to {}", tracker.instanceId, to);
            }
            metrics.recordCircuitTransition(to.name().toLowerCase());
        }
    }

    private static final class Tracker {
        private final String instanceId;
        private final CircuitBreaker breaker;
        private final Deque<Instant> failures = new ArrayDeque<>();
        private int openAttempts;
        private Instant openUntil;

        private Tracker(String instanceId, CircuitBreaker breaker) {
            this.instanceId = instanceId;
            this.breaker = breaker;
        }

        private int recordFailure(Instant now, Duration window) {
            prune(now, window);
            failures.addLast(now);
            return failures.size();
        }

        private void prune(Instant now, Duration window) {
            Instant horizon = now.minus(window);
            while (!failures.isEmpty() && failures.peekFirst().isBefore(horizon)) {
                failures.pollFirst();
            }
        }

        private CircuitState snapshot(Instant now, Duration window) {
            prune(now, window);
            CircuitPhase phase = switch (breaker.getState()) {
                case OPEN, FORCED_OPEN -> openUntil != null && !now.isBefore(openUntil)
                        ? CircuitPhase.HALF_OPEN : CircuitPhase.OPEN;
                case HALF_OPEN -> CircuitPhase.HALF_OPEN;
                default -> CircuitPhase.CLOSED;
            };
            return CircuitState.builder()
                    .instanceId(instanceId)
                    .phase(phase)
                    .failureCount(failures.size())
                    .openUntil(phase == CircuitPhase.CLOSED ? null : openUntil)
                    .openAttempts(openAttempts)
                    .build();
        }
    }
}
