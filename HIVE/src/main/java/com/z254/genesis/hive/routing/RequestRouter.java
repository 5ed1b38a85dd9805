package com.z254.genesis.hive.routing;

import com.fasterxml.jackson.databind.JsonNode;
import com.z254.genesis.common.error.ErrorCategory;
import com.z254.genesis.common.error.ErrorKind;
import com.z254.genesis.common.error.ErrorSeverity;
import com.z254.genesis.common.error.ErrorTranslator;
import com.z254.genesis.common.error.StandardError;
import com.z254.genesis.common.error.SwarmException;
import com.z254.genesis.common.observability.SwarmEventLogger;
import com.z254.genesis.common.web.CorrelationContext;
import com.z254.genesis.hive.config.HiveProperties;
import com.z254.genesis.hive.observability.HiveMetrics;
import com.z254.genesis.hive.registry.RegistryEvent;
import com.z254.genesis.hive.registry.ServiceInstance;
import com.z254.genesis.hive.registry.ServiceRegistry;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Routes opaque payloads to a worker of the requested role.
 * <p>
 * Candidates are the role's routable instances ordered by id; selection rotates through them
 * per role and skips instances whose circuit refuses the call. Transient failures are retried on
 * an instance not yet tried, up to the retry budget. Everything leaving this class is a
 * {@link SwarmException} carrying the request's correlation id.
 */
@Service
@Slf4j
public class RequestRouter {

    private final ServiceRegistry registry;
    private final CircuitBreakerManager circuits;
    private final WorkerClient workerClient;
    private final ErrorTranslator translator;
    private final HiveProperties.RouterProperties config;
    private final HiveMetrics metrics;
    private final SwarmEventLogger eventLogger;
    private final Map<String, AtomicInteger> cursors = new ConcurrentHashMap<>();
    private final Disposable registrySubscription;

    public RequestRouter(ServiceRegistry registry, CircuitBreakerManager circuits, WorkerClient workerClient,
                         ErrorTranslator translator, HiveProperties hiveProperties, HiveMetrics metrics,
                         SwarmEventLogger eventLogger) {
        this.registry = registry;
        this.circuits = circuits;
        this.workerClient = workerClient;
        this.translator = translator;
        this.config = hiveProperties.getRouter();
        this.metrics = metrics;
        this.eventLogger = eventLogger;

        this.registrySubscription = registry.events()
                .filter(event -> event.getType() == RegistryEvent.Type.DEREGISTERED)
                .subscribe(event -> circuits.forget(event.getInstanceId()),
                        e -> log.error("Registry change feed terminated", e));
    }

    @PreDestroy
    public void shutdown() {
        registrySubscription.dispose();
    }

    public Mono<RouteResult> route(String role, JsonNode payload) {
        return route(role, payload, null);
    }

    /**
     * Route a payload to an instance of {@code role}.
     *
     * @param timeout bound on the whole request including retries; the configured default when null
     */
    public Mono<RouteResult> route(String role, JsonNode payload, Duration timeout) {
        Duration deadline = effectiveTimeout(timeout);

        return CorrelationContext.current().flatMap(correlationId -> {
            if (role == null || role.isBlank()) {
                return Mono.error(fail(SwarmException.missingField("role").getError(), correlationId));
            }
            String normalizedRole = role.toLowerCase(Locale.ROOT);
            long startNanos = System.nanoTime();

            if (registry.eligible(normalizedRole).isEmpty()) {
                metrics.recordRoute(normalizedRole, "unavailable", Duration.ZERO);
                return Mono.error(fail(StandardError.of(ErrorKind.SERVICE_UNAVAILABLE,
                                "No healthy instance registered for role " + normalizedRole)
                        .withDetail("role", normalizedRole), correlationId));
            }

            Set<String> tried = ConcurrentHashMap.newKeySet();
            return attempt(normalizedRole, payload, correlationId, tried, null)
                    .timeout(deadline)
                    .onErrorMap(TimeoutException.class, e -> fail(StandardError.of(ErrorKind.TIMEOUT,
                                    "Request for role " + normalizedRole + " exceeded " + deadline.toMillis() + "ms")
                            .withSeverity(ErrorSeverity.ERROR)
                            .withDetail("role", normalizedRole)
                            .withDetail("attempts", tried.size()), correlationId))
                    .doOnSuccess(result -> metrics.recordRoute(normalizedRole, "success", elapsedSince(startNanos)))
                    .doOnError(e -> metrics.recordRoute(normalizedRole, outcomeOf(e), elapsedSince(startNanos)));
        });
    }

    public List<CircuitState> circuits() {
        return circuits.states();
    }

    private Mono<RouteResult> attempt(String role, JsonNode payload, String correlationId,
                                      Set<String> tried, StandardError lastError) {
        Optional<ServiceInstance> selected = select(role, tried);
        if (selected.isEmpty()) {
            return Mono.error(lastError == null
                    ? fail(StandardError.of(ErrorKind.SERVICE_UNAVAILABLE,
                            "All instances of role " + role + " are unavailable or have open circuits")
                            .withDetail("role", role), correlationId)
                    : exhausted(role, tried.size(), lastError, correlationId));
        }

        ServiceInstance target = selected.get();
        tried.add(target.getId());
        int attemptNumber = tried.size();
        long startNanos = System.nanoTime();
        AtomicBoolean settled = new AtomicBoolean(false);

        return Mono.defer(() -> workerClient.invoke(target, payload, correlationId))
                .timeout(config.getCallTimeout())
                .doOnCancel(() -> {
                    if (settled.compareAndSet(false, true)) {
                        circuits.release(target.getId());
                        log.debug("Call to {} cancelled, permission released", target.getId());
                    }
                })
                .map(response -> {
                    settled.set(true);
                    circuits.recordSuccess(target.getId(), elapsedSince(startNanos));
                    return RouteResult.builder()
                            .role(role)
                            .instanceId(target.getId())
                            .address(target.getAddress())
                            .attempts(attemptNumber)
                            .correlationId(correlationId)
                            .status(response.status())
                            .body(response.body())
                            .build();
                })
                .onErrorResume(failure -> {
                    if (!settled.compareAndSet(false, true)) {
                        return Mono.error(failure);
                    }
                    StandardError error = translator.translate(failure);
                    Duration elapsed = elapsedSince(startNanos);

                    if (error.isTransient()) {
                        circuits.recordFailure(target.getId(), elapsed, failure);
                        if (attemptNumber > config.getRetryBudget()) {
                            return Mono.error(exhausted(role, attemptNumber, error, correlationId));
                        }
                        log.info("Transient {} from {} for role {}, retrying elsewhere",
                                error.getKind().wireName(), target.getId(), role);
                        metrics.recordRetry(role, error.getKind().wireName());
                        return attempt(role, payload, correlationId, tried, error.withDetail("instanceId", target.getId()));
                    }

                    if (error.getCategory() == ErrorCategory.VALIDATION || error.getCategory() == ErrorCategory.RESOURCE) {
                        // answered by the worker, so the call counts as healthy
                        circuits.recordSuccess(target.getId(), elapsed);
                        return Mono.error(fail(error, correlationId));
                    }

                    circuits.recordFailure(target.getId(), elapsed, failure);
                    return Mono.error(fail(StandardError.of(ErrorKind.DEPENDENCY_FAILURE,
                                    "Instance " + target.getId() + " failed: " + error.getMessage())
                            .withDetail("role", role)
                            .withDetail("instanceId", target.getId())
                            .withDetail("causeKind", error.getKind() != null ? error.getKind().wireName() : "unknown"),
                            correlationId));
                });
    }

    private Optional<ServiceInstance> select(String role, Set<String> excluded) {
        List<ServiceInstance> candidates = registry.eligible(role).stream()
                .filter(instance -> !excluded.contains(instance.getId()))
                .toList();
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        int start = Math.floorMod(cursors.computeIfAbsent(role, r -> new AtomicInteger()).getAndIncrement(),
                candidates.size());
        for (int i = 0; i < candidates.size(); i++) {
            ServiceInstance candidate = candidates.get((start + i) % candidates.size());
            if (circuits.tryAcquire(candidate.getId())) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private SwarmException exhausted(String role, int attempts, StandardError lastError, String correlationId) {
        eventLogger.logEvent("route_exhausted", correlationId, Map.of(
                "role", role,
                "attempts", attempts,
                "lastKind", lastError.getKind().wireName()));
        return fail(StandardError.of(ErrorKind.DEPENDENCY_FAILURE,
                        "No instance of role " + role + " answered after " + attempts + " attempt(s)")
                .withDetail("role", role)
                .withDetail("attempts", attempts)
                .withDetail("lastKind", lastError.getKind().wireName())
                .withDetail("lastMessage", lastError.getMessage()), correlationId);
    }

    private SwarmException fail(StandardError error, String correlationId) {
        return new SwarmException(error.withCorrelationId(correlationId));
    }

    private Duration effectiveTimeout(Duration requested) {
        if (requested == null || requested.isZero() || requested.isNegative()) {
            return config.getRequestTimeout();
        }
        return requested.compareTo(config.getMaxRequestTimeout()) > 0 ? config.getMaxRequestTimeout() : requested;
    }

    private static String outcomeOf(Throwable failure) {
        if (failure instanceof SwarmException swarm && swarm.getKind() != null) {
            return swarm.getKind().wireName();
        }
        return "error";
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
