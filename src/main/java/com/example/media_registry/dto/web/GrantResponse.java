package com.example.media_registry.dto.web;

public record GrantResponse(long recordId, String principal, boolean canAccess) {
}
