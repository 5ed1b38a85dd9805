package com.z254.genesis.mnemos.api.v1;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.genesis.common.error.ErrorKind;
import com.z254.genesis.common.error.SwarmException;
import com.z254.genesis.mnemos.api.dto.MemoryRequest;
import com.z254.genesis.mnemos.retrieval.SearchQuery;
import com.z254.genesis.mnemos.service.MemoryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Entry point for payloads routed by HIVE. The {@code operation} field selects the memory
 * operation; the remaining fields are its arguments.
 */
@RestController
@RequestMapping("/api/v1/invoke")
@Tag(name = "Invocation", description = "Routed entry point for the memory core")
@Slf4j
public class InvocationController {

    private final MemoryService memoryService;
    private final ObjectMapper objectMapper;

    public InvocationController(MemoryService memoryService, ObjectMapper objectMapper) {
        this.memoryService = memoryService;
        this.objectMapper = objectMapper;
    }

    @PostMapping
    @Operation(summary = "Invoke", description = "Run put, get, reference, delete, page, search or backup")
    @ApiResponse(responseCode = "200", description = "Operation result")
    @ApiResponse(responseCode = "400", description = "Unknown operation or invalid arguments")
    public Mono<Object> invoke(@RequestBody(required = false) JsonNode payload) {
        return Mono.defer(() -> dispatch(payload != null ? payload : objectMapper.createObjectNode()));
    }

    private Mono<Object> dispatch(JsonNode payload) {
        String operation = text(payload, "operation");
        if (operation == null) {
            throw SwarmException.missingField("operation");
        }
        log.debug("Invoking memory operation {}", operation);

        return switch (operation) {
            case "put" -> memoryService.put(convert(payload, MemoryRequest.class).toRecord()).cast(Object.class);
            case "get" -> memoryService.get(requiredText(payload, "id")).cast(Object.class);
            case "reference" -> memoryService.reference(requiredText(payload, "id")).cast(Object.class);
            case "delete" -> {
                String id = requiredText(payload, "id");
                yield memoryService.delete(id).thenReturn((Object) Map.of("deleted", id));
            }
            case "page" -> memoryService.page(integer(payload, "page"), integer(payload, "pageSize"),
                    text(payload, "sort")).cast(Object.class);
            case "search" -> memoryService.search(convert(payload, SearchQuery.class)).cast(Object.class);
            case "backup" -> memoryService.backup().cast(Object.class);
            default -> throw SwarmException.of(ErrorKind.INVALID_INPUT, "Unknown operation: " + operation,
                    Map.of("field", "operation",
                            "allowed", "put, get, reference, delete, page, search, backup"));
        };
    }

    private <T> T convert(JsonNode payload, Class<T> type) {
        try {
            return objectMapper.treeToValue(payload, type);
        } catch (Exception e) {
            throw SwarmException.of(ErrorKind.INVALID_INPUT,
                    "Invalid arguments for " + type.getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    private static String text(JsonNode payload, String field) {
        JsonNode node = payload.get(field);
        return node == null || node.isNull() || node.asText().isBlank() ? null : node.asText();
    }

    private static String requiredText(JsonNode payload, String field) {
        String value = text(payload, field);
        if (value == null) {
            throw SwarmException.missingField(field);
        }
        return value;
    }

    private static Integer integer(JsonNode payload, String field) {
        JsonNode node = payload.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.canConvertToInt()) {
            throw SwarmException.of(ErrorKind.INVALID_INPUT, field + " must be an integer", Map.of("field", field));
        }
        return node.asInt();
    }
}
