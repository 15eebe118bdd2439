package com.example.media_registry.repository;

import com.example.media_registry.model.MediaRecord;
import org.springframework.data.jpa.repository.JpaRepository;

public interface MediaRecordRepository extends JpaRepository<MediaRecord, Long> {
}
