package com.z254.genesis.common.web;

import org.springframework.core.Ordered;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

/**
 * Attaches a correlation id at the point of entry.
 * <p>
 * An incoming {@code X-Correlation-ID} header is kept unchanged; otherwise a new id is
 * generated. The id is echoed on the response and written to the Reactor context for
 * downstream hops.
 */
public class CorrelationIdWebFilter implements WebFilter, Ordered {

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String incoming = exchange.getRequest().getHeaders().getFirst(CorrelationContext.HEADER);
        String correlationId = incoming == null || incoming.isBlank() ? CorrelationContext.newId() : incoming;

        exchange.getAttributes().put(CorrelationContext.ATTRIBUTE, correlationId);
        exchange.getResponse().getHeaders().set(CorrelationContext.HEADER, correlationId);

        return chain.filter(exchange)
                .contextWrite(CorrelationContext.with(correlationId));
    }

    @Override
    public int getOrder() {
        return Ordered.HIGHEST_PRECEDENCE;
    }
}
