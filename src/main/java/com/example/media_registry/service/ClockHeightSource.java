package com.example.media_registry.service;

import com.example.media_registry.service.Interfaces.HeightSource;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Height derived from the wall clock in epoch millis, bumped by one whenever the clock
 * stalls or steps back, so every call observes a strictly larger value.
 */
@Component
public class ClockHeightSource implements HeightSource {
    private final Clock clock;
    private final AtomicLong last = new AtomicLong();

    public ClockHeightSource(Clock clock) {
        this.clock = clock;
    }

    @Override
    public long currentHeight() {
        long now = clock.millis();
        return last.updateAndGet(prev -> Math.max(prev + 1, now));
    }
}
