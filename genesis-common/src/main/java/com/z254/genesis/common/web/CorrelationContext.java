package com.z254.genesis.common.web;

import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;
import reactor.util.context.Context;

import java.util.UUID;

/**
 * Correlation id propagation through HTTP headers, exchange attributes and the Reactor context.
 */
public final class CorrelationContext {

    public static final String HEADER = "X-Correlation-ID";
    public static final String CONTEXT_KEY = "genesis.correlationId";
    public static final String ATTRIBUTE = CorrelationContext.class.getName() + ".id";

    private CorrelationContext() {
    }

    public static String newId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Correlation id of the current subscriber, or a fresh one when the chain was not
     * entered through {@link CorrelationIdWebFilter}.
     */
    public static Mono<String> current() {
        return Mono.deferContextual(ctx -> Mono.just(ctx.<String>getOrEmpty(CONTEXT_KEY).orElseGet(CorrelationContext::newId)));
    }

    public static Context with(String correlationId) {
        return Context.of(CONTEXT_KEY, correlationId);
    }

    public static String fromExchange(ServerWebExchange exchange) {
        String id = exchange.getAttribute(ATTRIBUTE);
        if (id == null) {
            id = exchange.getRequest().getHeaders().getFirst(HEADER);
        }
        return id;
    }
}
