package com.z254.genesis.hive.registry;

import reactor.core.publisher.Mono;

/**
 * Liveness probe against a worker instance.
 */
public interface HealthProbeClient {

    /**
     * Probe an instance.
     *
     * @return the reported health, or empty when the probe failed or timed out
     */
    Mono<HealthState> probe(ServiceInstance instance);
}
