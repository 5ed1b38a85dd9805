package com.z254.genesis.hive.registry;

import com.fasterxml.jackson.databind.JsonNode;
import com.z254.genesis.hive.config.HiveProperties;
import com.z254.genesis.hive.observability.HiveMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * Probes the Spring Boot Actuator health endpoint of a worker.
 * {@code UP} counts as healthy, any other reported status as degraded.
 */
@Component
@Slf4j
public class WebClientHealthProbeClient implements HealthProbeClient {

    private final WebClient webClient;
    private final HiveProperties.RegistryProperties.ProbeProperties config;
    private final HiveMetrics metrics;

    public WebClientHealthProbeClient(WebClient.Builder webClientBuilder, HiveProperties hiveProperties,
                                      HiveMetrics metrics) {
        this.webClient = webClientBuilder.build();
        this.config = hiveProperties.getRegistry().getProbe();
        this.metrics = metrics;
    }

    @Override
    public Mono<HealthState> probe(ServiceInstance instance) {
        return webClient.get()
                .uri(instance.getAddress() + config.getPath())
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(config.getTimeout())
                .map(body -> "UP".equalsIgnoreCase(body.path("status").asText())
                        ? HealthState.HEALTHY : HealthState.DEGRADED)
                .onErrorResume(e -> {
                    log.debug("Probe of {} at {} failed: {}", instance.getId(), instance.getAddress(), e.toString());
                    metrics.recordProbeFailure();
                    return Mono.empty();
                });
    }
}
