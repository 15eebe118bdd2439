package com.example.media_registry.dto.web;

import java.util.List;

public record RecordResponse(long recordId, String name, String owner, long byteCount, long createdAt,
                             String summary, List<String> labels) {
}
