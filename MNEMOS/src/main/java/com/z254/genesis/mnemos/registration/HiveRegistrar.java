package com.z254.genesis.mnemos.registration;

import com.z254.genesis.mnemos.config.MnemosProperties;
import com.z254.genesis.mnemos.store.MemoryStore;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.UUID;

/**
 * Keeps this worker registered with HIVE: registers once the web server is up, heartbeats on
 * a fixed delay and deregisters on shutdown.
 */
@Component
@Slf4j
public class HiveRegistrar {

    private static final List<String> CAPABILITIES = List.of(
            "memory.put", "memory.get", "memory.reference", "memory.delete",
            "memory.page", "memory.search", "memory.backup");

    private final HiveRegistrationClient client;
    private final MemoryStore store;
    private final MnemosProperties.HiveClientProperties config;
    private volatile HiveRegistrationClient.Registration registration;

    public HiveRegistrar(HiveRegistrationClient client, MemoryStore store, MnemosProperties mnemosProperties) {
        this.client = client;
        this.store = store;
        this.config = mnemosProperties.getHive();
    }

    @EventListener
    public void onWebServerInitialized(WebServerInitializedEvent event) {
        if (!client.isEnabled()) {
            return;
        }
        int port = event.getWebServer().getPort();
        registration = new HiveRegistrationClient.Registration(
                config.getInstanceId() == null || config.getInstanceId().isBlank()
                        ? config.getRole() + "-" + UUID.randomUUID().toString().substring(0, 8)
                        : config.getInstanceId(),
                config.getRole(),
                config.getAdvertisedAddress() == null || config.getAdvertisedAddress().isBlank()
                        ? "http://localhost:" + port
                        : config.getAdvertisedAddress(),
                CAPABILITIES);

        client.register(registration)
                .subscribe(null, e -> log.warn("Initial registration failed, will retry on next heartbeat: {}",
                        e.getMessage()));
    }

    @Scheduled(fixedDelayString = "${mnemos.hive.heartbeat-interval-ms:10000}")
    public void heartbeat() {
        HiveRegistrationClient.Registration current = registration;
        if (current == null) {
            return;
        }
        client.heartbeat(current.id(), currentStatus())
                .flatMap(known -> known ? Mono.<Void>empty() : client.register(current))
                .subscribe(null, e -> log.debug("Heartbeat cycle failed: {}", e.getMessage()));
    }

    @PreDestroy
    public void deregister() {
        HiveRegistrationClient.Registration current = registration;
        if (current == null) {
            return;
        }
        try {
            client.deregister(current.id()).block(config.getTimeout().multipliedBy(2));
        } catch (RuntimeException e) {
            log.warn("Deregistration from HIVE failed: {}", e.getMessage());
        }
    }

    HiveRegistrationClient.Registration registration() {
        return registration;
    }

    String currentStatus() {
        return store.isWritable() ? "healthy" : "degraded";
    }
}
