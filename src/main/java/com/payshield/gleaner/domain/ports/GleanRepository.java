package com.payshield.gleaner.domain.ports;

import com.payshield.gleaner.domain.GleanRecord;

import java.util.List;
import java.util.UUID;

public interface GleanRepository {
    void saveAll(UUID runId, List<GleanRecord> gleans);

    List<GleanRecord> findAll(int page, int size);

    List<GleanRecord> findByVendor(String vendorId, int page, int size);

    long countByRun(UUID runId);
}
