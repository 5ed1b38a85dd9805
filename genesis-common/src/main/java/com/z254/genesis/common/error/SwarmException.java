package com.z254.genesis.common.error;

import lombok.Getter;

import java.util.Map;

/**
 * Unchecked carrier for a {@link StandardError} across reactive and blocking call chains.
 */
@Getter
public class SwarmException extends RuntimeException {

    private final StandardError error;

    public SwarmException(StandardError error) {
        super(error.getMessage());
        this.error = error;
    }

    public SwarmException(StandardError error, Throwable cause) {
        super(error.getMessage(), cause);
        this.error = error;
    }

    public static SwarmException of(ErrorKind kind, String message) {
        return new SwarmException(StandardError.of(kind, message));
    }

    public static SwarmException of(ErrorKind kind, String message, Map<String, Object> details) {
        StandardError error = StandardError.of(kind, message);
        error.getDetails().putAll(details);
        return new SwarmException(error);
    }

    public static SwarmException of(ErrorKind kind, String message, Throwable cause) {
        return new SwarmException(StandardError.of(kind, message), cause);
    }

    public static SwarmException invalidInput(String message) {
        return of(ErrorKind.INVALID_INPUT, message);
    }

    public static SwarmException missingField(String field) {
        return of(ErrorKind.MISSING_FIELD, "Required field is missing: " + field, Map.of("field", field));
    }

    public static SwarmException notFound(String resource, String id) {
        return of(ErrorKind.RESOURCE_NOT_FOUND, resource + " not found: " + id,
                Map.of("resource", resource, "id", id));
    }

    public ErrorKind getKind() {
        return error.getKind();
    }
}
