package com.example.media_registry.service;

import com.example.media_registry.model.MediaRecord;
import com.example.media_registry.repository.MediaRecordRepository;
import com.example.media_registry.util.MediaValidator;
import com.example.media_registry.util.RegistryErrorKind;
import com.example.media_registry.util.RegistryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ResponseStatusException;

/**
 * Loads a record for mutation and enforces {@code caller == owner}.
 */
@Component
public class OwnershipGuard {
    private static final Logger log = LoggerFactory.getLogger(OwnershipGuard.class);
    private final MediaRecordRepository recordRepo;

    public OwnershipGuard(MediaRecordRepository recordRepo) {
        this.recordRepo = recordRepo;
    }

    public MediaRecord requireOwned(long recordId, String caller) {
        requirePrincipal(caller, "CALLER_REQUIRED");
        var record = recordRepo.findById(recordId)
                .orElseThrow(() -> missing(recordId));
        if (!record.isOwnedBy(caller)) {
            log.debug("Rejected caller={} on record={} owned by {}", caller, recordId, record.getOwner());
            throw new RegistryException(RegistryErrorKind.OWNERSHIP_VIOLATION,
                    "caller is not the owner of record " + recordId);
        }
        return record;
    }

    public RegistryException missing(long recordId) {
        return new RegistryException(RegistryErrorKind.MISSING_RECORD, "no record with id " + recordId);
    }

    static void requirePrincipal(String principal, String code) {
        if (!MediaValidator.validatePrincipal(principal)) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, code);
        }
    }
}
