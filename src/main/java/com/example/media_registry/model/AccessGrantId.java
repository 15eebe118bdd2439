package com.example.media_registry.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

import java.io.Serializable;
import java.util.Objects;

@Embeddable
public class AccessGrantId implements Serializable {
    @Column(name = "record_id", nullable = false)
    private Long recordId;

    @Column(name = "principal", nullable = false, length = 256)
    private String principal;

    public AccessGrantId() {
    }

    public AccessGrantId(Long recordId, String principal) {
        this.recordId = recordId;
        this.principal = principal;
    }

    public Long getRecordId() {
        return recordId;
    }

    public String getPrincipal() {
        return principal;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AccessGrantId that = (AccessGrantId) o;
        return Objects.equals(recordId, that.recordId) && Objects.equals(principal, that.principal);
    }

    @Override
    public int hashCode() {
        return Objects.hash(recordId, principal);
    }
}
