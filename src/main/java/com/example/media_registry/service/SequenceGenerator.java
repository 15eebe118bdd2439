package com.example.media_registry.service;

import com.example.media_registry.model.RegistrySequence;
import com.example.media_registry.repository.RegistrySequenceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Issues media record identifiers from the {@code media_record} counter row.
 */
@Service
public class SequenceGenerator {
    static final String MEDIA_RECORD_SEQUENCE = "media_record";
    private static final Logger LOGGER = LoggerFactory.getLogger(SequenceGenerator.class);

    private final RegistrySequenceRepository sequenceRepo;

    public SequenceGenerator(RegistrySequenceRepository sequenceRepo) {
        this.sequenceRepo = sequenceRepo;
    }

    /**
     * Advances the counter under a row lock and returns the new value. Joins the caller's
     * transaction, so the increment is discarded when the creation that asked for it fails.
     *
     * @return previous counter value plus one
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public long nextId() {
        RegistrySequence sequence = sequenceRepo.findForUpdate(MEDIA_RECORD_SEQUENCE)
                .orElseGet(() -> new RegistrySequence(MEDIA_RECORD_SEQUENCE));
        long next = sequence.advance();
        sequenceRepo.save(sequence);
        LOGGER.debug("SequenceGenerator next sequence={} value={}", MEDIA_RECORD_SEQUENCE, next);
        return next;
    }

    /**
     * Current counter value, 0 before the first creation.
     */
    @Transactional(readOnly = true)
    public long current() {
        return sequenceRepo.findById(MEDIA_RECORD_SEQUENCE)
                .map(RegistrySequence::getTotalItems)
                .orElse(0L);
    }
}
