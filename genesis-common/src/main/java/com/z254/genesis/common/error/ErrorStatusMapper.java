package com.z254.genesis.common.error;

import org.springframework.http.HttpStatus;

/**
 * Maps error categories to HTTP status codes.
 */
public final class ErrorStatusMapper {

    private ErrorStatusMapper() {
    }

    public static HttpStatus statusFor(StandardError error) {
        ErrorKind kind = error.getKind();
        if (kind == ErrorKind.RESOURCE_CORRUPTED || kind == ErrorKind.STORAGE_FAILURE) {
            return HttpStatus.INTERNAL_SERVER_ERROR;
        }
        ErrorCategory category = error.getCategory() != null
                ? error.getCategory()
                : kind != null ? kind.getCategory() : ErrorCategory.UNKNOWN;
        return switch (category) {
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case AUTHENTICATION -> HttpStatus.UNAUTHORIZED;
            case AUTHORIZATION -> HttpStatus.FORBIDDEN;
            case RESOURCE -> HttpStatus.NOT_FOUND;
            case SERVICE -> HttpStatus.SERVICE_UNAVAILABLE;
            case DEPENDENCY, NETWORK -> HttpStatus.BAD_GATEWAY;
            case TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
            case INTERNAL, UNKNOWN -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
