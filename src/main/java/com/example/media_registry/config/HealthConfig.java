package com.example.media_registry.config;

import com.example.media_registry.service.SequenceGenerator;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class HealthConfig {

    @Bean
    public HealthIndicator registrySequenceHealth(SequenceGenerator sequenceGenerator) {
        return () -> {
            try {
                return Health.up().withDetail("totalItems", sequenceGenerator.current()).build();
            } catch (Exception e) {
                return Health.down(e).withDetail("registrySequence", "unreadable").build();
            }
        };
    }
}
