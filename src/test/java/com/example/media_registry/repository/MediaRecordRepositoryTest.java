package com.example.media_registry.repository;

import com.example.media_registry.model.AccessGrant;
import com.example.media_registry.model.AccessGrantId;
import com.example.media_registry.model.MediaMetadata;
import com.example.media_registry.model.MediaRecord;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.dao.DataIntegrityViolationException;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DataJpaTest
class MediaRecordRepositoryTest {

    @Autowired
    private MediaRecordRepository recordRepository;

    @Autowired
    private AccessGrantRepository grantRepository;

    @Autowired
    private RegistrySequenceRepository sequenceRepository;

    @Autowired
    private TestEntityManager entityManager;

    @Test
    void labelsRoundTripInInsertionOrder() {
        recordRepository.saveAndFlush(new MediaRecord(1L, "alice", 99L,
                new MediaMetadata("clip.mp4", 1024, "demo", List.of("video", "archive", "raw"))));
        entityManager.clear();

        assertThat(recordRepository.findById(1L))
                .isPresent()
                .get()
                .satisfies(found -> {
                    assertThat(found.getLabels()).containsExactly("video", "archive", "raw");
                    assertThat(found.getCreatedAt()).isEqualTo(99L);
                    assertThat(found.getOwner()).isEqualTo("alice");
                });
    }

    @Test
    void migrationSeedsTheRecordCounter() {
        assertThat(sequenceRepository.findForUpdate("media_record"))
                .isPresent()
                .get()
                .satisfies(seq -> assertThat(seq.getTotalItems()).isZero());
    }

    @Test
    void purgeRemovesOnlyGrantsOfTheGivenRecord() {
        grantRepository.saveAndFlush(new AccessGrant(1L, "alice", true));
        grantRepository.saveAndFlush(new AccessGrant(1L, "bob", true));
        grantRepository.saveAndFlush(new AccessGrant(2L, "alice", true));

        int removed = grantRepository.deleteByRecordId(1L);

        entityManager.clear();

        assertThat(removed).isEqualTo(2);
        assertThat(grantRepository.existsById(new AccessGrantId(1L, "alice"))).isFalse();
        assertThat(grantRepository.existsById(new AccessGrantId(1L, "bob"))).isFalse();
        assertThat(grantRepository.existsById(new AccessGrantId(2L, "alice"))).isTrue();
    }

    @Test
    void schemaRejectsOutOfRangeByteCount() {
        MediaRecord oversized = new MediaRecord(3L, "alice", 1L,
                new MediaMetadata("clip.mp4", 1_000_000_000L, "demo", List.of("video")));

        assertThrows(DataIntegrityViolationException.class, () -> recordRepository.saveAndFlush(oversized));
    }
}
