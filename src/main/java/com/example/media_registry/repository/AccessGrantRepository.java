package com.example.media_registry.repository;

import com.example.media_registry.model.AccessGrant;
import com.example.media_registry.model.AccessGrantId;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AccessGrantRepository extends JpaRepository<AccessGrant, AccessGrantId> {

    @Modifying
    @Query("delete from AccessGrant g where g.id.recordId = :recordId")
    int deleteByRecordId(@Param("recordId") Long recordId);
}
