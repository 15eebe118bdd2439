package com.example.media_registry.service.Interfaces;

/**
 * Supplies the host height for the current call. Successive calls never return a smaller value.
 */
public interface HeightSource {
    long currentHeight();
}
