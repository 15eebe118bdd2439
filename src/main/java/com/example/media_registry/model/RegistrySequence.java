package com.example.media_registry.model;

import jakarta.persistence.*;

/**
 * Named monotonic counter. {@code totalItems} only ever moves forward.
 */
@Entity
@Table(name = "registry_sequence")
public class RegistrySequence {
    @Id
    @Column(name = "name", nullable = false, updatable = false, length = 64)
    private String name;

    @Column(name = "total_items", nullable = false)
    private long totalItems;

    protected RegistrySequence() {
    }

    public RegistrySequence(String name) {
        this.name = name;
    }

    /**
     * Moves the counter one step forward and returns the new value.
     */
    public long advance() {
        totalItems = Math.incrementExact(totalItems);
        return totalItems;
    }

    public String getName() {
        return name;
    }

    public long getTotalItems() {
        return totalItems;
    }
}
