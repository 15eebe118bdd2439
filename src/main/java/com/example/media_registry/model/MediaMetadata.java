package com.example.media_registry.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The caller-controlled subset of a {@link MediaRecord}. Owner, id and creation height
 * are not part of it, so applying metadata can never touch them.
 *
 * @param name      display name
 * @param byteCount asset size in bytes
 * @param summary   short description
 * @param labels    ordered category labels; may contain nulls until validated
 */
public record MediaMetadata(String name, long byteCount, String summary, List<String> labels) {
    public MediaMetadata {
        labels = labels == null ? null : Collections.unmodifiableList(new ArrayList<>(labels));
    }
}
