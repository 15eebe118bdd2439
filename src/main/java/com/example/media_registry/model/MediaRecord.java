package com.example.media_registry.model;

import jakarta.persistence.*;

import java.util.ArrayList;
import java.util.List;

/**
 * A registered media-metadata entry. The id, the creation height and the owner
 * have no setters: metadata changes go through {@link #applyMetadata(MediaMetadata)}
 * and owner changes through {@link #transferTo(String)}.
 */
@Entity
@Table(name = "media_record", indexes = {
        @Index(name = "idx_media_record_owner", columnList = "owner")
})
public class MediaRecord {
    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "name", nullable = false, length = 63)
    private String name;

    @Column(name = "owner", nullable = false, length = 256)
    private String owner;

    @Column(name = "byte_count", nullable = false)
    private long byteCount;

    @Column(name = "created_at_height", nullable = false, updatable = false)
    private long createdAt;

    @Column(name = "summary", nullable = false, length = 127)
    private String summary;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "media_record_label", joinColumns = @JoinColumn(name = "record_id",
            foreignKey = @ForeignKey(name = "fk_label_record")))
    @OrderColumn(name = "label_order")
    @Column(name = "label", nullable = false, length = 32)
    private List<String> labels = new ArrayList<>();

    // wrapper type so a fresh record (null version) is persisted, not merged
    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    protected MediaRecord() {
    }

    public MediaRecord(long id, String owner, long createdAt, MediaMetadata metadata) {
        this.id = id;
        this.owner = owner;
        this.createdAt = createdAt;
        applyMetadata(metadata);
    }

    /**
     * Replaces the mutable fields (name, byte count, summary, labels) with the given values.
     */
    public void applyMetadata(MediaMetadata metadata) {
        this.name = metadata.name();
        this.byteCount = metadata.byteCount();
        this.summary = metadata.summary();
        this.labels.clear();
        this.labels.addAll(metadata.labels());
    }

    public void transferTo(String newOwner) {
        this.owner = newOwner;
    }

    public boolean isOwnedBy(String principal) {
        return owner != null && owner.equals(principal);
    }

    public MediaMetadata metadata() {
        return new MediaMetadata(name, byteCount, summary, labels);
    }

    public Long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getOwner() {
        return owner;
    }

    public long getByteCount() {
        return byteCount;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public String getSummary() {
        return summary;
    }

    public List<String> getLabels() {
        return List.copyOf(labels);
    }
}
