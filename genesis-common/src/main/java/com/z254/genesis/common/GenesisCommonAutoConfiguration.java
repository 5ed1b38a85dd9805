package com.z254.genesis.common;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.genesis.common.error.ErrorTranslator;
import com.z254.genesis.common.observability.SwarmEventLogger;
import com.z254.genesis.common.web.CorrelationIdWebFilter;
import com.z254.genesis.common.web.SwarmErrorHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.context.annotation.Bean;

import java.time.Clock;

/**
 * Auto-configuration shared by every GENESIS service.
 *
 * <p>Provides:</p>
 * <ul>
 *   <li>Correlation id propagation via {@code X-Correlation-ID}</li>
 *   <li>Error translation and StandardError rendering</li>
 *   <li>Structured JSON event logging</li>
 *   <li>A system UTC {@link Clock} that tests can replace</li>
 * </ul>
 */
@AutoConfiguration(after = JacksonAutoConfiguration.class)
public class GenesisCommonAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock genesisClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public ErrorTranslator errorTranslator() {
        return new ErrorTranslator();
    }

    @Bean
    @ConditionalOnMissingBean
    public SwarmEventLogger swarmEventLogger(ObjectMapper objectMapper,
                                             @Value("${spring.application.name:genesis}") String serviceName) {
        return new SwarmEventLogger(objectMapper, serviceName);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.REACTIVE)
    public CorrelationIdWebFilter correlationIdWebFilter() {
        return new CorrelationIdWebFilter();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.REACTIVE)
    public SwarmErrorHandler swarmErrorHandler(ErrorTranslator errorTranslator, SwarmEventLogger eventLogger) {
        return new SwarmErrorHandler(errorTranslator, eventLogger);
    }
}
