package com.example.media_registry.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Enables registry-specific configuration properties.
 */
@Configuration
@EnableConfigurationProperties(RegistryProperties.class)
public class AppPropertiesConfig {
}
