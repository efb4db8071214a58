package com.payshield.gleaner.infrastructure.jpa;

import com.payshield.gleaner.domain.GleanLocation;
import com.payshield.gleaner.domain.GleanType;
import jakarta.persistence.*;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "glean", indexes = {
        @Index(name = "idx_glean_vendor", columnList = "canonical_vendor_id"),
        @Index(name = "idx_glean_run", columnList = "run_id")
})
public class GleanEntity {

    @Id
    @Column(name = "glean_id")
    private UUID gleanId;

    @Column(name = "run_id", nullable = false)
    private UUID runId;

    @Column(name = "glean_date", nullable = false)
    private LocalDate gleanDate;

    @Column(name = "glean_text", nullable = false, columnDefinition = "TEXT")
    private String gleanText;

    @Convert(converter = GleanTypeConverter.class)
    @Column(name = "glean_type", nullable = false, length = 40)
    private GleanType gleanType;

    @Convert(converter = GleanLocationConverter.class)
    @Column(name = "glean_location", nullable = false, length = 16)
    private GleanLocation gleanLocation;

    @Column(name = "invoice_id")
    private String invoiceId;

    @Column(name = "canonical_vendor_id", nullable = false)
    private String canonicalVendorId;

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;

    public GleanEntity() {}

    public UUID getGleanId() { return gleanId; }
    public void setGleanId(UUID gleanId) { this.gleanId = gleanId; }

    public UUID getRunId() { return runId; }
    public void setRunId(UUID runId) { this.runId = runId; }

    public LocalDate getGleanDate() { return gleanDate; }
    public void setGleanDate(LocalDate gleanDate) { this.gleanDate = gleanDate; }

    public String getGleanText() { return gleanText; }
    public void setGleanText(String gleanText) { this.gleanText = gleanText; }

    public GleanType getGleanType() { return gleanType; }
    public void setGleanType(GleanType gleanType) { this.gleanType = gleanType; }

    public GleanLocation getGleanLocation() { return gleanLocation; }
    public void setGleanLocation(GleanLocation gleanLocation) { this.gleanLocation = gleanLocation; }

    public String getInvoiceId() { return invoiceId; }
    public void setInvoiceId(String invoiceId) { this.invoiceId = invoiceId; }

    public String getCanonicalVendorId() { return canonicalVendorId; }
    public void setCanonicalVendorId(String canonicalVendorId) { this.canonicalVendorId = canonicalVendorId; }

    public OffsetDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(OffsetDateTime createdAt) { this.createdAt = createdAt; }

    @Override
    public String toString() {
        return "GleanEntity{" +
                "gleanId=" + gleanId +
                ", runId=" + runId +
                ", gleanDate=" + gleanDate +
                ", gleanType=" + gleanType +
                ", invoiceId='" + invoiceId + '\'' +
                ", canonicalVendorId='" + canonicalVendorId + '\'' +
                '}';
    }
}
