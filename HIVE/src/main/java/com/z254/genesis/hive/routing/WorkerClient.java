package com.z254.genesis.hive.routing;

import com.fasterxml.jackson.databind.JsonNode;
import com.z254.genesis.hive.registry.ServiceInstance;
import reactor.core.publisher.Mono;

/**
 * Transport to a worker instance's invocation endpoint.
 * <p>
 * Implementations signal failures as {@link com.z254.genesis.common.error.SwarmException}
 * carrying the worker's {@link com.z254.genesis.common.error.StandardError}, or as raw
 * transport exceptions which the router translates.
 */
public interface WorkerClient {

    Mono<WorkerResponse> invoke(ServiceInstance instance, JsonNode payload, String correlationId);

    record WorkerResponse(int status, JsonNode body) {
    }
}
