package com.z254.genesis.common.error;

import org.springframework.validation.FieldError;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.Exceptions;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.ConnectException;
import java.nio.file.AccessDeniedException;
import java.nio.file.NoSuchFileException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Translates lower-level failures into the closest {@link StandardError} kind so that no raw
 * transport or storage exception crosses a component boundary.
 */
public class ErrorTranslator {

    public StandardError translate(Throwable throwable) {
        Throwable failure = unwrap(throwable);

        if (failure instanceof SwarmException swarm) {
            return swarm.getError();
        }
        if (failure instanceof WebExchangeBindException bind) {
            Map<String, Object> fields = new LinkedHashMap<>();
            for (FieldError fieldError : bind.getFieldErrors()) {
                fields.put(fieldError.getField(), fieldError.getDefaultMessage());
            }
            return StandardError.of(ErrorKind.INVALID_INPUT, "Request validation failed")
                    .withDetail("fields", fields);
        }
        if (failure instanceof ServerWebInputException input) {
            return StandardError.of(ErrorKind.INVALID_INPUT,
                    input.getReason() != null ? input.getReason() : "Malformed request");
        }
        if (failure instanceof ResponseStatusException status) {
            return fromStatus(status);
        }
        if (failure instanceof IllegalArgumentException) {
            return StandardError.of(ErrorKind.INVALID_INPUT, failure.getMessage());
        }
        if (failure instanceof TimeoutException) {
            return StandardError.of(ErrorKind.TIMEOUT, "Operation timed out");
        }
        if (failure instanceof ConnectException || failure instanceof WebClientRequestException) {
            return StandardError.of(ErrorKind.NETWORK_ERROR, "Network failure: " + failure.getMessage());
        }
        if (failure instanceof NoSuchFileException missing) {
            return StandardError.of(ErrorKind.RESOURCE_NOT_FOUND, "Resource not found: " + missing.getFile());
        }
        if (failure instanceof AccessDeniedException denied) {
            return StandardError.of(ErrorKind.STORAGE_FAILURE, "Permission denied: " + denied.getFile())
                    .withDetail("reason", "permission-denied");
        }
        if (failure instanceof IOException io) {
            return storageFailure(io);
        }
        return StandardError.of(ErrorKind.INTERNAL_ERROR, "Internal error")
                .withDetail("exception", failure.getClass().getSimpleName());
    }

    public SwarmException toException(Throwable throwable) {
        if (throwable instanceof SwarmException swarm) {
            return swarm;
        }
        return new SwarmException(translate(throwable), throwable);
    }

    private StandardError fromStatus(ResponseStatusException status) {
        int code = status.getStatusCode().value();
        String reason = status.getReason() != null ? status.getReason() : status.getMessage();
        if (code == 404) {
            return StandardError.of(ErrorKind.RESOURCE_NOT_FOUND, reason);
        }
        if (code == 503) {
            return StandardError.of(ErrorKind.SERVICE_UNAVAILABLE, reason);
        }
        if (code == 504) {
            return StandardError.of(ErrorKind.TIMEOUT, reason);
        }
        if (code >= 400 && code < 500) {
            return StandardError.of(ErrorKind.INVALID_INPUT, reason).withDetail("status", code);
        }
        return StandardError.of(ErrorKind.INTERNAL_ERROR, reason).withDetail("status", code);
    }

    private StandardError storageFailure(IOException io) {
        String message = io.getMessage() != null ? io.getMessage() : io.getClass().getSimpleName();
        String reason = message.toLowerCase().contains("no space") ? "disk-full" : "io-error";
        return StandardError.of(ErrorKind.STORAGE_FAILURE, "Storage failure: " + message)
                .withDetail("reason", reason);
    }

    private Throwable unwrap(Throwable throwable) {
        Throwable current = Exceptions.unwrap(throwable);
        while ((current instanceof CompletionException
                || current instanceof ExecutionException
                || current instanceof UncheckedIOException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
