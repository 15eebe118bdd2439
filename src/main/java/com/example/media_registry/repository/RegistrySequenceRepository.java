package com.example.media_registry.repository;

import com.example.media_registry.model.RegistrySequence;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface RegistrySequenceRepository extends JpaRepository<RegistrySequence, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select s from RegistrySequence s where s.name = :name")
    Optional<RegistrySequence> findForUpdate(@Param("name") String name);
}
