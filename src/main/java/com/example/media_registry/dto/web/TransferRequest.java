package com.example.media_registry.dto.web;

public record TransferRequest(String newOwner) {
}
