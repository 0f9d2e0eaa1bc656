package com.folautech.alert.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.folautech.metric.aggregator.AlertAggregator;
import com.folautech.metric.classifier.StatusClassifier;
import com.folautech.metric.exception.RegistryIntegrityException;
import com.folautech.metric.registry.RangeRegistry;
import com.folautech.metric.registry.RangeRegistryLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;

/**
 * Wires the classification engine. The registry is loaded once at startup; a missing or
 * inconsistent table fails the application context.
 */
@Configuration
@EnableConfigurationProperties(RegistryProperties.class)
public class EngineConfig {

    private static final Logger logger = LoggerFactory.getLogger(EngineConfig.class);

    @Bean
    public RangeRegistry rangeRegistry(RegistryProperties properties, ResourceLoader resourceLoader,
                                       ObjectMapper objectMapper) {
        Resource resource = resourceLoader.getResource(properties.getLocation());
        if (!resource.exists()) {
            throw new RegistryIntegrityException("Reference range table not found: " + properties.getLocation());
        }
        logger.info("Loading reference ranges from {}", properties.getLocation());
        try {
            return new RangeRegistryLoader(objectMapper).load(resource.getInputStream(), resource.getDescription());
        } catch (IOException e) {
            throw new RegistryIntegrityException("Cannot read reference range table " + properties.getLocation(), e);
        }
    }

    @Bean
    public StatusClassifier statusClassifier(RangeRegistry rangeRegistry) {
        return new StatusClassifier(rangeRegistry);
    }

    @Bean
    public AlertAggregator alertAggregator(StatusClassifier statusClassifier) {
        return new AlertAggregator(statusClassifier);
    }
}
