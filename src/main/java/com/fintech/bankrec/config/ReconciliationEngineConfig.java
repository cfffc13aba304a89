package com.fintech.bankrec.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Turns {@code reconciliation.*} properties into the immutable run defaults.
 */
@Configuration
@EnableConfigurationProperties(ReconciliationProperties.class)
@Slf4j
public class ReconciliationEngineConfig {

    @Bean
    public ReconciliationConfig reconciliationConfig(ReconciliationProperties properties) {
        ReconciliationConfig config = properties.toConfig();
        log.info("Reconciliation defaults: batch {}, amount tolerance {}c, date window {}d, min confidence {}",
                config.effectiveBatchSize(), config.getTolerance().getAmountToleranceCents(),
                config.getTolerance().getDateWindowDays(), config.getMinConfidence());
        return config;
    }
}
