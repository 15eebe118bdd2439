package com.example.media_registry.dto.web;

public record RegistryStatsResponse(long totalItems) {
}
