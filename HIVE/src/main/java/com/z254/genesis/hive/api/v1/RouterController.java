package com.z254.genesis.hive.api.v1;

import com.fasterxml.jackson.databind.JsonNode;
import com.z254.genesis.common.web.CorrelationContext;
import com.z254.genesis.hive.routing.CircuitState;
import com.z254.genesis.hive.routing.RequestRouter;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * REST controller for routed requests.
 */
@RestController
@RequestMapping("/api/v1/route")
@Tag(name = "Router", description = "Health-aware, circuit-breaking request routing")
@Slf4j
public class RouterController {

    public static final String TIMEOUT_HEADER = "X-Request-Timeout-Ms";
    public static final String INSTANCE_HEADER = "X-Routed-Instance";
    public static final String ATTEMPTS_HEADER = "X-Route-Attempts";

    private final RequestRouter router;

    public RouterController(RequestRouter router) {
        this.router = router;
    }

    @PostMapping("/{role}")
    @Operation(summary = "Route request", description = "Forward an opaque payload to a healthy instance of the role")
    @ApiResponse(responseCode = "200", description = "Worker response")
    @ApiResponse(responseCode = "502", description = "Retry budget exhausted or instance failure")
    @ApiResponse(responseCode = "503", description = "No routable instance")
    @ApiResponse(responseCode = "504", description = "Request deadline exceeded")
    public Mono<ResponseEntity<JsonNode>> route(
            @Parameter(description = "Worker role") @PathVariable String role,
            @RequestHeader(value = TIMEOUT_HEADER, required = false) Long timeoutMs,
            @RequestBody(required = false) JsonNode payload) {

        Duration timeout = timeoutMs != null ? Duration.ofMillis(timeoutMs) : null;
        return router.route(role, payload, timeout)
                .map(result -> ResponseEntity.status(result.getStatus())
                        .header(INSTANCE_HEADER, result.getInstanceId())
                        .header(ATTEMPTS_HEADER, String.valueOf(result.getAttempts()))
                        .header(CorrelationContext.HEADER, result.getCorrelationId())
                        .body(result.getBody()));
    }

    @GetMapping("/circuits")
    @Operation(summary = "Circuit states", description = "Circuit state of every tracked instance")
    public Mono<List<CircuitState>> circuits() {
        return Mono.fromCallable(router::circuits);
    }
}
