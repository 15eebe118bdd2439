package com.example.media_registry.dto.web;

public record RecordCreatedResponse(long recordId) {
}
