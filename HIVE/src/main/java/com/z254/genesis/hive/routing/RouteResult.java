package com.z254.genesis.hive.routing;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of a successfully routed request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RouteResult {

    private String role;
    private String instanceId;
    private String address;
    /** Instances tried, including the one that answered. */
    private int attempts;
    private String correlationId;
    private int status;
    private JsonNode body;
}
