package com.z254.genesis.common.web;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class CorrelationIdWebFilterTest {

    private final CorrelationIdWebFilter filter = new CorrelationIdWebFilter();

    @Test
    @DisplayName("should keep an incoming correlation id and expose it downstream")
    void keepsIncomingId() {
        MockServerWebExchange exchange = MockServerWebExchange.from(
                MockServerHttpRequest.get("/api/v1/route/memory").header(CorrelationContext.HEADER, "corr-42"));
        AtomicReference<String> seen = new AtomicReference<>();
        WebFilterChain chain = ex -> CorrelationContext.current().doOnNext(seen::set).then();

        StepVerifier.create(filter.filter(exchange, chain)).verifyComplete();

        assertThat(seen.get()).isEqualTo("corr-42");
        assertThat(exchange.getResponse().getHeaders().getFirst(CorrelationContext.HEADER)).isEqualTo("corr-42");
        assertThat(CorrelationContext.fromExchange(exchange)).isEqualTo("corr-42");
    }

    @Test
    @DisplayName("should generate a correlation id when none is supplied")
    void generatesId() {
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/"));

        StepVerifier.create(filter.filter(exchange, ex -> Mono.empty())).verifyComplete();

        assertThat(exchange.getResponse().getHeaders().getFirst(CorrelationContext.HEADER)).isNotBlank();
    }
}
