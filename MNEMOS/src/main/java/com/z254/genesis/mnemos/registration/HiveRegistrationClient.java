package com.z254.genesis.mnemos.registration;

import com.z254.genesis.mnemos.config.MnemosProperties;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * WebClient-based client for the HIVE registry.
 * Runs in stub mode, where every call completes without effect, when no hub URL is configured.
 */
@Component
@Slf4j
public class HiveRegistrationClient {

    private final WebClient webClient;
    private final MnemosProperties.HiveClientProperties config;
    private final boolean stubMode;

    public HiveRegistrationClient(WebClient.Builder webClientBuilder, MnemosProperties mnemosProperties) {
        this.config = mnemosProperties.getHive();
        this.stubMode = config.getBaseUrl() == null || config.getBaseUrl().isBlank();

        if (!stubMode) {
            this.webClient = webClientBuilder
                    .baseUrl(config.getBaseUrl())
                    .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .build();
        } else {
            this.webClient = null;
            log.warn("HIVE registration client running in stub mode - no hub configured");
        }
    }

    public boolean isEnabled() {
        return !stubMode;
    }

    @Retry(name = "hive-registration")
    public Mono<Void> register(Registration registration) {
        if (stubMode) {
            return Mono.empty();
        }

        return webClient.post()
                .uri("/api/v1/registry/instances")
                .bodyValue(registration)
                .retrieve()
                .toBodilessEntity()
                .timeout(config.getTimeout())
                .doOnSuccess(r -> log.info("Registered with HIVE as {} at {}", registration.id(), registration.address()))
                .doOnError(e -> log.warn("Failed to register with HIVE: {}", e.getMessage()))
                .then();
    }

    /**
     * Report health to the hub.
     *
     * @return false when the hub no longer knows this instance and it has to register again
     */
    @Retry(name = "hive-registration")
    public Mono<Boolean> heartbeat(String instanceId, String status) {
        if (stubMode) {
            return Mono.just(true);
        }

        return webClient.post()
                .uri("/api/v1/registry/instances/{id}/heartbeat", instanceId)
                .bodyValue(Map.of("status", status))
                .exchangeToMono(response -> {
                    if (response.statusCode().is2xxSuccessful()) {
                        return response.releaseBody().thenReturn(true);
                    }
                    if (response.statusCode().value() == HttpStatus.NOT_FOUND.value()) {
                        return response.releaseBody().thenReturn(false);
                    }
                    return response.createException().flatMap(Mono::error);
                })
                .timeout(config.getTimeout())
                .doOnError(e -> log.warn("Heartbeat to HIVE failed: {}", e.getMessage()));
    }

    public Mono<Void> deregister(String instanceId) {
        if (stubMode) {
            return Mono.empty();
        }

        return webClient.delete()
                .uri("/api/v1/registry/instances/{id}", instanceId)
                .retrieve()
                .toBodilessEntity()
                .timeout(config.getTimeout())
                .doOnSuccess(r -> log.info("Deregistered {} from HIVE", instanceId))
                .then();
    }

    public record Registration(String id, String role, String address, List<String> capabilities) {
    }
}
