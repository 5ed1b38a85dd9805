package com.z254.genesis.hive;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.z254.genesis.common.web.CorrelationContext;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.web.reactive.function.server.RouterFunction;
import org.springframework.web.reactive.function.server.RouterFunctions;
import org.springframework.web.reactive.function.server.ServerResponse;

import static org.springframework.web.reactive.function.server.RequestPredicates.POST;

/**
 * Test configuration that lets the HIVE under test act as its own echo worker.
 */
@TestConfiguration
public class HiveTestConfiguration {

    @Bean
    public RouterFunction<ServerResponse> echoWorker() {
        return RouterFunctions.route(POST("/api/v1/invoke"), request -> request.bodyToMono(JsonNode.class)
                .defaultIfEmpty(NullNode.getInstance())
                .flatMap(payload -> {
                    ObjectNode body = JsonNodeFactory.instance.objectNode();
                    body.set("echo", payload);
                    body.put("receivedCorrelationId",
                            request.headers().firstHeader(CorrelationContext.HEADER));
                    return ServerResponse.ok().bodyValue(body);
                }));
    }
}
