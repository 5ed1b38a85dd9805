package com.z254.genesis.hive.routing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.z254.genesis.common.error.ErrorKind;
import com.z254.genesis.common.error.StandardError;
import com.z254.genesis.common.error.SwarmException;
import com.z254.genesis.common.web.CorrelationContext;
import com.z254.genesis.hive.config.HiveProperties;
import com.z254.genesis.hive.registry.ServiceInstance;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * WebClient-based implementation of WorkerClient.
 * Forwards the payload to {@code POST {address}{invoke-path}} with the correlation id header.
 */
@Component
@Slf4j
public class WebClientWorkerClient implements WorkerClient {

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final String invokePath;

    public WebClientWorkerClient(WebClient.Builder webClientBuilder, ObjectMapper objectMapper,
                                 HiveProperties hiveProperties) {
        this.webClient = webClientBuilder.build();
        this.objectMapper = objectMapper;
        this.invokePath = hiveProperties.getRouter().getInvokePath();
    }

    @Override
    public Mono<WorkerResponse> invoke(ServiceInstance instance, JsonNode payload, String correlationId) {
        return webClient.post()
                .uri(instance.getAddress() + invokePath)
                .header(CorrelationContext.HEADER, correlationId)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(payload != null ? payload : NullNode.getInstance())
                .exchangeToMono(response -> {
                    HttpStatusCode status = response.statusCode();
                    if (status.is2xxSuccessful()) {
                        return response.bodyToMono(JsonNode.class)
                                .defaultIfEmpty(NullNode.getInstance())
                                .map(body -> new WorkerResponse(status.value(), body));
                    }
                    return response.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .flatMap(body -> Mono.error(new SwarmException(workerError(instance, status, body))));
                })
                .doOnError(e -> log.debug("Call to {} failed: {}", instance.getId(), e.toString()));
    }

    private StandardError workerError(ServiceInstance instance, HttpStatusCode status, String body) {
        StandardError parsed = parse(body);
        StandardError error = parsed != null ? parsed : StandardError.of(kindFor(status),
                "Worker " + instance.getId() + " answered HTTP " + status.value());
        return error.withDetail("instanceId", instance.getId())
                .withDetail("httpStatus", status.value());
    }

    private StandardError parse(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            StandardError error = objectMapper.readValue(body, StandardError.class);
            return error.getKind() != null ? error : null;
        } catch (Exception e) {
            log.debug("Worker error body is not a StandardError: {}", e.getMessage());
            return null;
        }
    }

    private static ErrorKind kindFor(HttpStatusCode status) {
        return switch (status.value()) {
            case 502 -> ErrorKind.NETWORK_ERROR;
            case 503 -> ErrorKind.SERVICE_UNAVAILABLE;
            case 504 -> ErrorKind.TIMEOUT;
            case 404 -> ErrorKind.RESOURCE_NOT_FOUND;
            default -> status.is4xxClientError() ? ErrorKind.INVALID_INPUT : ErrorKind.INTERNAL_ERROR;
        };
    }
}
