package com.example.media_registry.dto.web;

public record OkResponse(boolean ok) {
    public static final OkResponse OK = new OkResponse(true);
}
