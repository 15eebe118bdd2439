package com.example.media_registry.service;

import com.example.media_registry.config.RegistryProperties;
import com.example.media_registry.model.MediaMetadata;
import com.example.media_registry.model.MediaRecord;
import com.example.media_registry.repository.MediaRecordRepository;
import com.example.media_registry.service.Interfaces.HeightSource;
import com.example.media_registry.util.MediaValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Record store operations. Each public method is one transaction: checks run first in a
 * fixed order (caller, existence, ownership, field bounds) and any failure rolls back
 * every write of the call.
 */
@Service
@Transactional
public class ArchiveService {
    private static final Logger log = LoggerFactory.getLogger(ArchiveService.class);

    private final MediaRecordRepository recordRepo;
    private final SequenceGenerator sequenceGenerator;
    private final AccessMatrixService accessMatrix;
    private final OwnershipGuard ownershipGuard;
    private final HeightSource heightSource;
    private final RegistryProperties properties;

    public ArchiveService(MediaRecordRepository recordRepo,
                          SequenceGenerator sequenceGenerator,
                          AccessMatrixService accessMatrix,
                          OwnershipGuard ownershipGuard,
                          HeightSource heightSource,
                          RegistryProperties properties) {
        this.recordRepo = recordRepo;
        this.sequenceGenerator = sequenceGenerator;
        this.accessMatrix = accessMatrix;
        this.ownershipGuard = ownershipGuard;
        this.heightSource = heightSource;
        this.properties = properties;
    }

    /**
     * Registers a new record owned by {@code caller}.
     *
     * @return the freshly assigned record id
     */
    public long create(MediaMetadata metadata, String caller) {
        OwnershipGuard.requirePrincipal(caller, "CALLER_REQUIRED");
        MediaValidator.requireValid(metadata);

        long id = sequenceGenerator.nextId();
        var record = new MediaRecord(id, caller, heightSource.currentHeight(), metadata);
        recordRepo.save(record);
        accessMatrix.grantCreator(id, caller);

        log.info("Archived media record id={} owner={} height={}", id, caller, record.getCreatedAt());
        return id;
    }

    @Transactional(readOnly = true)
    public Optional<MediaRecord> read(long recordId) {
        return recordRepo.findById(recordId);
    }

    /**
     * Same as {@link #read(long)} but fails with a missing-record error when absent.
     */
    @Transactional(readOnly = true)
    public MediaRecord get(long recordId) {
        return read(recordId).orElseThrow(() -> ownershipGuard.missing(recordId));
    }

    public void update(long recordId, MediaMetadata metadata, String caller) {
        var record = ownershipGuard.requireOwned(recordId, caller);
        MediaValidator.requireValid(metadata);
        record.applyMetadata(metadata);
        recordRepo.save(record);
        log.info("Updated media record id={} by={}", recordId, caller);
    }

    public void transfer(long recordId, String newOwner, String caller) {
        var record = ownershipGuard.requireOwned(recordId, caller);
        OwnershipGuard.requirePrincipal(newOwner, "NEW_OWNER_REQUIRED");
        record.transferTo(newOwner);
        recordRepo.save(record);
        log.info("Transferred media record id={} from={} to={}", recordId, caller, newOwner);
    }

    public void delete(long recordId, String caller) {
        var record = ownershipGuard.requireOwned(recordId, caller);
        recordRepo.delete(record);
        if (properties.getAccess().isPurgeOnDelete()) {
            accessMatrix.purge(recordId);
        }
        log.info("Deleted media record id={} by={}", recordId, caller);
    }
}
