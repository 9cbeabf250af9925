package com.purchasingpower.codegraph.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the standalone {@code @ConfigurationProperties} classes.
 * {@code AppProperties} registers itself as a {@code @Configuration}.
 */
@Configuration
@EnableConfigurationProperties({
    GeminiConfig.class
})
public class ConfigurationPropertiesEnablerConfig {
}
