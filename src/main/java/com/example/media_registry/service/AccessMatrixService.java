package com.example.media_registry.service;

import com.example.media_registry.model.AccessGrant;
import com.example.media_registry.model.AccessGrantId;
import com.example.media_registry.repository.AccessGrantRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Per-record access grants. Grant and revoke are reserved to the record owner; the
 * creator's grant is written as part of record creation.
 */
@Service
@Transactional
public class AccessMatrixService {
    private static final Logger log = LoggerFactory.getLogger(AccessMatrixService.class);

    private final AccessGrantRepository grantRepo;
    private final OwnershipGuard ownershipGuard;

    public AccessMatrixService(AccessGrantRepository grantRepo, OwnershipGuard ownershipGuard) {
        this.grantRepo = grantRepo;
        this.ownershipGuard = ownershipGuard;
    }

    /**
     * Creation-time grant for the creator; runs inside the creating transaction.
     */
    public void grantCreator(long recordId, String creator) {
        upsert(recordId, creator, true);
    }

    /**
     * Grants {@code principal} access to the record. Idempotent.
     */
    public void grant(long recordId, String principal, String caller) {
        ownershipGuard.requireOwned(recordId, caller);
        OwnershipGuard.requirePrincipal(principal, "PRINCIPAL_REQUIRED");
        upsert(recordId, principal, true);
        log.info("Granted access record={} principal={} by={}", recordId, principal, caller);
    }

    /**
     * Revokes access of {@code principal}. Succeeds when there was nothing to revoke.
     */
    public void revoke(long recordId, String principal, String caller) {
        ownershipGuard.requireOwned(recordId, caller);
        OwnershipGuard.requirePrincipal(principal, "PRINCIPAL_REQUIRED");
        grantRepo.findById(new AccessGrantId(recordId, principal))
                .ifPresent(grant -> {
                    grant.setCanAccess(false);
                    grantRepo.save(grant);
                });
        log.info("Revoked access record={} principal={} by={}", recordId, principal, caller);
    }

    @Transactional(readOnly = true)
    public boolean check(long recordId, String principal) {
        return grantRepo.findById(new AccessGrantId(recordId, principal))
                .map(AccessGrant::isCanAccess)
                .orElse(false);
    }

    /**
     * Drops every grant of a deleted record.
     *
     * @return number of grants removed
     */
    public int purge(long recordId) {
        int removed = grantRepo.deleteByRecordId(recordId);
        log.debug("Purged {} grants of record={}", removed, recordId);
        return removed;
    }

    private void upsert(long recordId, String principal, boolean canAccess) {
        var grant = grantRepo.findById(new AccessGrantId(recordId, principal))
                .orElseGet(() -> new AccessGrant(recordId, principal, canAccess));
        grant.setCanAccess(canAccess);
        grantRepo.save(grant);
    }
}
