package com.z254.genesis.common.web;

import com.z254.genesis.common.error.ErrorSeverity;
import com.z254.genesis.common.error.ErrorStatusMapper;
import com.z254.genesis.common.error.ErrorTranslator;
import com.z254.genesis.common.error.StandardError;
import com.z254.genesis.common.observability.SwarmEventLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebExchange;

/**
 * Renders every failure leaving a controller as a {@link StandardError} body.
 */
@Slf4j
@RestControllerAdvice
public class SwarmErrorHandler {

    private final ErrorTranslator translator;
    private final SwarmEventLogger eventLogger;

    public SwarmErrorHandler(ErrorTranslator translator, SwarmEventLogger eventLogger) {
        this.translator = translator;
        this.eventLogger = eventLogger;
    }

    @ExceptionHandler(Throwable.class)
    public ResponseEntity<StandardError> handle(Throwable failure, ServerWebExchange exchange) {
        StandardError error = translator.translate(failure);

        String correlationId = error.getCorrelationId();
        if (correlationId == null) {
            correlationId = CorrelationContext.fromExchange(exchange);
            if (correlationId == null) {
                correlationId = CorrelationContext.newId();
            }
            error = error.withCorrelationId(correlationId);
        }

        if (error.getSeverity() == ErrorSeverity.CRITICAL) {
            log.error("Request {} {} failed: {}", exchange.getRequest().getMethod(),
                    exchange.getRequest().getPath(), error.getMessage(), failure);
        } else {
            log.debug("Request {} {} failed: {}", exchange.getRequest().getMethod(),
                    exchange.getRequest().getPath(), error.getMessage());
        }
        eventLogger.logError(error);

        return ResponseEntity.status(ErrorStatusMapper.statusFor(error))
                .contentType(MediaType.APPLICATION_JSON)
                .header(CorrelationContext.HEADER, correlationId)
                .body(error);
    }
}
