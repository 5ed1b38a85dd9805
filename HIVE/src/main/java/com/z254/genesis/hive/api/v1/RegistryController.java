package com.z254.genesis.hive.api.v1;

import com.z254.genesis.hive.api.dto.HeartbeatRequest;
import com.z254.genesis.hive.api.dto.RegisterInstanceRequest;
import com.z254.genesis.hive.registry.RegistryEvent;
import com.z254.genesis.hive.registry.ServiceInstance;
import com.z254.genesis.hive.registry.ServiceRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * REST controller for the service registry.
 */
@RestController
@RequestMapping("/api/v1/registry")
@Tag(name = "Registry", description = "Worker registration, heartbeats and change feed")
@Slf4j
public class RegistryController {

    private final ServiceRegistry registry;

    public RegistryController(ServiceRegistry registry) {
        this.registry = registry;
    }

    @PostMapping("/instances")
    @Operation(summary = "Register instance", description = "Register a worker instance with health unknown")
    @ApiResponse(responseCode = "201", description = "Instance registered")
    @ApiResponse(responseCode = "400", description = "Missing field or id registered with another address")
    public Mono<ResponseEntity<ServiceInstance>> register(@Valid @RequestBody RegisterInstanceRequest request) {
        return Mono.fromCallable(() -> registry.register(request.toInstance()))
                .map(instance -> ResponseEntity.status(HttpStatus.CREATED).body(instance));
    }

    @GetMapping("/instances")
    @Operation(summary = "List instances", description = "List registered instances, optionally by role")
    public Flux<ServiceInstance> list(@RequestParam(required = false) String role) {
        return Flux.defer(() -> Flux.fromIterable(registry.list(role)));
    }

    @GetMapping("/instances/{id}")
    @Operation(summary = "Get instance")
    @ApiResponse(responseCode = "200", description = "Instance found")
    @ApiResponse(responseCode = "404", description = "Instance not found")
    public Mono<ServiceInstance> get(@Parameter(description = "Instance ID") @PathVariable String id) {
        return Mono.fromCallable(() -> registry.get(id));
    }

    @DeleteMapping("/instances/{id}")
    @Operation(summary = "Deregister instance", description = "Idempotent; unknown ids are not an error")
    @ApiResponse(responseCode = "204", description = "Instance deregistered")
    public Mono<ResponseEntity<Void>> deregister(@Parameter(description = "Instance ID") @PathVariable String id) {
        return Mono.fromRunnable(() -> registry.deregister(id))
                .then(Mono.just(ResponseEntity.noContent().<Void>build()));
    }

    @PostMapping("/instances/{id}/heartbeat")
    @Operation(summary = "Heartbeat", description = "Report health and refresh the heartbeat timestamp")
    @ApiResponse(responseCode = "200", description = "Heartbeat recorded")
    @ApiResponse(responseCode = "404", description = "Instance not registered")
    public Mono<ServiceInstance> heartbeat(@Parameter(description = "Instance ID") @PathVariable String id,
                                           @RequestBody(required = false) HeartbeatRequest request) {
        return Mono.fromCallable(() -> registry.heartbeat(id, request != null ? request.getStatus() : null));
    }

    @GetMapping(value = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    @Operation(summary = "Change feed", description = "Server-sent registry transitions")
    public Flux<ServerSentEvent<RegistryEvent>> events() {
        return registry.events()
                .onBackpressureBuffer(1024)
                .map(event -> ServerSentEvent.<RegistryEvent>builder()
                        .event(event.getType().name().toLowerCase())
                        .id(event.getInstanceId())
                        .data(event)
                        .build());
    }
}
