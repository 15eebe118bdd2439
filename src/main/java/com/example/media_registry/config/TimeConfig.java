package com.example.media_registry.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
class TimeConfig {
    @Bean
    public Clock heightClock() {
        return Clock.systemUTC();
    }
}
