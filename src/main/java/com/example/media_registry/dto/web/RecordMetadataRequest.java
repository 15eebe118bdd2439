package com.example.media_registry.dto.web;

import com.example.media_registry.model.MediaMetadata;

import java.util.List;

/**
 * Body of create and update calls. Bounds are enforced by the registry, not here, so a
 * bad field comes back with its registry error kind.
 */
public record RecordMetadataRequest(String name, Long byteCount, String summary, List<String> labels) {
    public MediaMetadata toMetadata() {
        return new MediaMetadata(name, byteCount == null ? 0L : byteCount, summary, labels);
    }
}
