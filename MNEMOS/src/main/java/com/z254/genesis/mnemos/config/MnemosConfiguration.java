package com.z254.genesis.mnemos.config;

import com.github.benmanes.caffeine.cache.Ticker;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MnemosConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Ticker cacheTicker() {
        return Ticker.systemTicker();
    }
}
