package com.payshield.gleaner.infrastructure.jpa;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface SpringGleanRepository extends JpaRepository<GleanEntity, UUID> {

    List<GleanEntity> findByCanonicalVendorIdOrderByGleanDateAscGleanIdAsc(String canonicalVendorId, Pageable pageable);

    List<GleanEntity> findAllByOrderByGleanDateAscGleanIdAsc(Pageable pageable);

    long countByRunId(UUID runId);
}
