package com.example.media_registry.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MediaRecordTest {

    @Test
    void applyMetadataLeavesIdOwnerAndHeightUntouched() {
        MediaRecord record = new MediaRecord(7L, "alice", 120L,
                new MediaMetadata("clip.mp4", 1024, "demo", List.of("video")));

        record.applyMetadata(new MediaMetadata("cut.mov", 2048, "edited", List.of("video", "final")));

        assertThat(record.getId()).isEqualTo(7L);
        assertThat(record.getOwner()).isEqualTo("alice");
        assertThat(record.getCreatedAt()).isEqualTo(120L);
        assertThat(record.getName()).isEqualTo("cut.mov");
        assertThat(record.getByteCount()).isEqualTo(2048);
        assertThat(record.getSummary()).isEqualTo("edited");
        assertThat(record.getLabels()).containsExactly("video", "final");
    }

    @Test
    void labelsAreCopiedOnTheWayInAndOut() {
        List<String> labels = new ArrayList<>(List.of("video"));
        MediaRecord record = new MediaRecord(1L, "alice", 1L, new MediaMetadata("clip.mp4", 1, "demo", labels));
        labels.add("leaked");

        assertThat(record.getLabels()).containsExactly("video");
        assertThatThrownBy(() -> record.getLabels().add("x")).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void transferChangesOwnershipOnly() {
        MediaRecord record = new MediaRecord(1L, "alice", 5L, new MediaMetadata("clip.mp4", 1, "demo", List.of("video")));
        MediaMetadata before = record.metadata();

        record.transferTo("bob");

        assertThat(record.isOwnedBy("bob")).isTrue();
        assertThat(record.isOwnedBy("alice")).isFalse();
        assertThat(record.metadata()).isEqualTo(before);
    }
}
