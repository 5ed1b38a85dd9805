package com.z254.genesis.hive.registry;

import com.z254.genesis.common.error.ErrorKind;
import com.z254.genesis.common.error.SwarmException;
import com.z254.genesis.common.observability.SwarmEventLogger;
import com.z254.genesis.hive.observability.HiveMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;

/**
 * Owner of the live worker table.
 * <p>
 * Every mutation goes through {@link ConcurrentHashMap#compute} so writers are serialized per
 * instance id while readers see consistent copies. Each transition is published on the change
 * feed returned by {@link #events()}.
 */
@Service
@Slf4j
public class ServiceRegistry {

    private final Map<String, ServiceInstance> instances = new ConcurrentHashMap<>();
    private final Sinks.Many<RegistryEvent> eventSink = Sinks.many().multicast().directBestEffort();

    private final Clock clock;
    private final HiveMetrics metrics;
    private final SwarmEventLogger eventLogger;

    public ServiceRegistry(Clock clock, HiveMetrics metrics, SwarmEventLogger eventLogger) {
        this.clock = clock;
        this.metrics = metrics;
        this.eventLogger = eventLogger;
        metrics.registerInstanceGauge(instances::size);
    }

    /**
     * Register a worker. Re-registering the same id at the same address refreshes the descriptor
     * and resets its health to unknown; a different address is rejected.
     */
    public ServiceInstance register(ServiceInstance descriptor) {
        String id = required(descriptor.getId(), "id");
        String role = required(descriptor.getRole(), "role").toLowerCase(Locale.ROOT);
        String address = normalizeAddress(required(descriptor.getAddress(), "address"));
        Instant now = clock.instant();

        ServiceInstance stored = instances.compute(id, (key, existing) -> {
            if (existing != null && !existing.getAddress().equals(address)) {
                throw SwarmException.of(ErrorKind.INVALID_INPUT,
                        "Instance " + id + " is already registered with a different address",
                        Map.of("id", id, "registeredAddress", existing.getAddress(), "requestedAddress", address));
            }
            return ServiceInstance.builder()
                    .id(id)
                    .role(role)
                    .address(address)
                    .capabilities(descriptor.getCapabilities() != null
                            ? new ArrayList<>(descriptor.getCapabilities()) : new ArrayList<>())
                    .health(HealthState.UNKNOWN)
                    .lastHeartbeat(now)
                    .registeredAt(existing != null ? existing.getRegisteredAt() : now)
                    .build();
        });

        log.info("Registered instance {} role={} address={}", id, role, address);
        publish(RegistryEvent.builder()
                .type(RegistryEvent.Type.REGISTERED)
                .instanceId(id)
                .role(role)
                .health(HealthState.UNKNOWN)
                .timestamp(now)
                .build());
        return stored.copy();
    }

    /**
     * Remove a worker. Idempotent.
     *
     * @return true if the instance was present
     */
    public boolean deregister(String id) {
        return removeIf(id, "deregistered", instance -> true);
    }

    public ServiceInstance get(String id) {
        ServiceInstance instance = instances.get(id);
        if (instance == null) {
            throw SwarmException.notFound("Service instance", id);
        }
        return instance.copy();
    }

    /**
     * All instances, optionally filtered by role, ordered by id.
     */
    public List<ServiceInstance> list(String role) {
        String wanted = role == null || role.isBlank() ? null : role.toLowerCase(Locale.ROOT);
        return instances.values().stream()
                .filter(i -> wanted == null || wanted.equals(i.getRole()))
                .sorted(Comparator.comparing(ServiceInstance::getId))
                .map(ServiceInstance::copy)
                .toList();
    }

    /**
     * Routable instances of a role, ordered by id.
     */
    public List<ServiceInstance> eligible(String role) {
        return list(role).stream()
                .filter(i -> i.getHealth().isRoutable())
                .toList();
    }

    public ServiceInstance heartbeat(String id, HealthState status) {
        HealthState reported = status != null ? status : HealthState.HEALTHY;
        Instant now = clock.instant();
        AtomicReference<HealthState> previous = new AtomicReference<>();

        ServiceInstance updated = instances.computeIfPresent(id, (key, existing) -> {
            previous.set(existing.getHealth());
            return existing.toBuilder()
                    .health(reported)
                    .lastHeartbeat(now)
                    .build();
        });
        if (updated == null) {
            throw SwarmException.notFound("Service instance", id);
        }

        metrics.recordHeartbeat();
        if (previous.get() != reported) {
            publishHealthChange(updated, previous.get(), "heartbeat");
        }
        return updated.copy();
    }

    /**
     * Mark an instance unhealthy if it has stayed silent since {@code silentSince}.
     * The condition is re-checked under the instance's lock so a concurrent heartbeat wins.
     */
    public boolean markStale(String id, Instant silentSince) {
        AtomicReference<HealthState> previous = new AtomicReference<>();
        ServiceInstance updated = instances.computeIfPresent(id, (key, existing) -> {
            if (existing.getHealth() == HealthState.UNHEALTHY || !existing.getLastHeartbeat().isBefore(silentSince)) {
                return existing;
            }
            previous.set(existing.getHealth());
            return existing.toBuilder().health(HealthState.UNHEALTHY).build();
        });
        if (updated == null || previous.get() == null) {
            return false;
        }
        log.warn("Instance {} missed heartbeats since {}, marked unhealthy", id, updated.getLastHeartbeat());
        publishHealthChange(updated, previous.get(), "stale");
        return true;
    }

    /**
     * Deregister an instance if it has stayed silent since {@code silentSince}.
     */
    public boolean expire(String id, Instant silentSince) {
        return removeIf(id, "expired", instance -> instance.getLastHeartbeat().isBefore(silentSince));
    }

    public Flux<RegistryEvent> events() {
        return eventSink.asFlux();
    }

    public int size() {
        return instances.size();
    }

    public Duration silenceOf(ServiceInstance instance) {
        return Duration.between(instance.getLastHeartbeat(), clock.instant());
    }

    private boolean removeIf(String id, String reason, Predicate<ServiceInstance> condition) {
        AtomicReference<ServiceInstance> removed = new AtomicReference<>();
        instances.computeIfPresent(id, (key, existing) -> {
            if (!condition.test(existing)) {
                return existing;
            }
            removed.set(existing);
            return null;
        });

        ServiceInstance gone = removed.get();
        if (gone == null) {
            return false;
        }
        log.info("Deregistered instance {} ({})", id, reason);
        publish(RegistryEvent.builder()
                .type(RegistryEvent.Type.DEREGISTERED)
                .instanceId(id)
                .role(gone.getRole())
                .previousHealth(gone.getHealth())
                .reason(reason)
                .timestamp(clock.instant())
                .build());
        return true;
    }

    private void publishHealthChange(ServiceInstance instance, HealthState previous, String reason) {
        publish(RegistryEvent.builder()
                .type(RegistryEvent.Type.HEALTH_CHANGED)
                .instanceId(instance.getId())
                .role(instance.getRole())
                .previousHealth(previous)
                .health(instance.getHealth())
                .reason(reason)
                .timestamp(clock.instant())
                .build());
    }

    private void publish(RegistryEvent event) {
        metrics.recordRegistryEvent(event.getType().name().toLowerCase(Locale.ROOT));
        eventLogger.logEvent("registry_" + event.getType().name().toLowerCase(Locale.ROOT), Map.of(
                "instanceId", event.getInstanceId(),
                "role", event.getRole(),
                "health", event.getHealth() != null ? event.getHealth().wireName() : "none"
        ));
        Sinks.EmitResult result;
        synchronized (eventSink) {
            result = eventSink.tryEmitNext(event);
        }
        if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            log.debug("Change feed dropped {} event for {}: {}", event.getType(), event.getInstanceId(), result);
        }
    }

    private static String required(String value, String field) {
        if (value == null || value.isBlank()) {
            throw SwarmException.missingField(field);
        }
        return value.trim();
    }

    private static String normalizeAddress(String address) {
        try {
            URI uri = new URI(address);
            if (uri.getScheme() == null || uri.getHost() == null
                    || !(uri.getScheme().equals("http") || uri.getScheme().equals("https"))) {
                throw SwarmException.invalidInput("Address must be an absolute http(s) URL: " + address);
            }
        } catch (URISyntaxException e) {
            throw SwarmException.invalidInput("Malformed address: " + address);
        }
        return address.endsWith("/") ? address.substring(0, address.length() - 1) : address;
    }
}
