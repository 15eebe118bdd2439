package com.example.media_registry.model;

import jakarta.persistence.*;

/**
 * One cell of the access matrix. There is no foreign key to {@code media_record}:
 * grants may outlive their record when purging on delete is switched off.
 */
@Entity
@Table(name = "access_grant", indexes = {
        @Index(name = "idx_access_grant_record", columnList = "record_id")
})
public class AccessGrant {
    @EmbeddedId
    private AccessGrantId id;

    @Column(name = "can_access", nullable = false)
    private boolean canAccess;

    protected AccessGrant() {
    }

    public AccessGrant(long recordId, String principal, boolean canAccess) {
        this.id = new AccessGrantId(recordId, principal);
        this.canAccess = canAccess;
    }

    public AccessGrantId getId() {
        return id;
    }

    public boolean isCanAccess() {
        return canAccess;
    }

    public void setCanAccess(boolean canAccess) {
        this.canAccess = canAccess;
    }
}
