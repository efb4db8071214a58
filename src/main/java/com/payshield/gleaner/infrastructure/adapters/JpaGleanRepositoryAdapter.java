package com.payshield.gleaner.infrastructure.adapters;

import com.payshield.gleaner.domain.Glean;
import com.payshield.gleaner.domain.GleanRecord;
import com.payshield.gleaner.domain.ports.GleanRepository;
import com.payshield.gleaner.exception.GleanDetectionException;
import com.payshield.gleaner.infrastructure.jpa.GleanEntity;
import com.payshield.gleaner.infrastructure.jpa.SpringGleanRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Component
public class JpaGleanRepositoryAdapter implements GleanRepository {

    private static final Logger log = LoggerFactory.getLogger(JpaGleanRepositoryAdapter.class);
    private final SpringGleanRepository gleans;

    public JpaGleanRepositoryAdapter(SpringGleanRepository gleans) {
        this.gleans = gleans;
    }

    @Override
    @Transactional
    public void saveAll(UUID runId, List<GleanRecord> records) {
        OffsetDateTime now = OffsetDateTime.now();
        List<GleanEntity> entities = new ArrayList<>(records.size());
        for (GleanRecord record : records) {
            entities.add(toEntity(runId, record, now));
        }
        try {
            gleans.saveAllAndFlush(entities);
            log.info("Saved {} gleans for run {}", entities.size(), runId);
        } catch (Exception e) {
            log.error("Failed to save gleans for run {}: {}", runId, e.getMessage());
            throw new GleanDetectionException("Failed to save gleans for run " + runId, e);
        }
    }

    @Override
    public List<GleanRecord> findAll(int page, int size) {
        return gleans.findAllByOrderByGleanDateAscGleanIdAsc(PageRequest.of(page, size))
                .stream()
                .map(this::entityToDomain)
                .toList();
    }

    @Override
    public List<GleanRecord> findByVendor(String vendorId, int page, int size) {
        return gleans.findByCanonicalVendorIdOrderByGleanDateAscGleanIdAsc(vendorId, PageRequest.of(page, size))
                .stream()
                .map(this::entityToDomain)
                .toList();
    }

    @Override
    public long countByRun(UUID runId) {
        return gleans.countByRunId(runId);
    }

    private GleanEntity toEntity(UUID runId, GleanRecord record, OffsetDateTime createdAt) {
        Glean g = record.glean();
        GleanEntity e = new GleanEntity();
        e.setGleanId(record.gleanId());
        e.setRunId(runId);
        e.setGleanDate(g.emissionDate());
        e.setGleanText(g.text());
        e.setGleanType(g.type());
        e.setGleanLocation(g.location());
        e.setInvoiceId(g.invoiceId());
        e.setCanonicalVendorId(g.vendorId());
        e.setCreatedAt(createdAt);
        return e;
    }

    private GleanRecord entityToDomain(GleanEntity e) {
        return new GleanRecord(e.getGleanId(), new Glean(
                e.getGleanDate(),
                e.getGleanText(),
                e.getGleanType(),
                e.getGleanLocation(),
                e.getInvoiceId(),
                e.getCanonicalVendorId()));
    }
}
