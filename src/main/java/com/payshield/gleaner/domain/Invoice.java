package com.payshield.gleaner.domain;

import java.math.BigDecimal;
import java.time.LocalDate;

public class Invoice {

    private final String invoiceId;
    private final LocalDate invoiceDate;
    private final LocalDate dueDate;
    private final LocalDate periodStartDate;
    private final LocalDate periodEndDate;
    private final BigDecimal totalAmount;
    private final String vendorId;

    public Invoice(String invoiceId, LocalDate invoiceDate, LocalDate dueDate, LocalDate periodStartDate,
                   LocalDate periodEndDate, BigDecimal totalAmount, String vendorId) {
        this.invoiceId = invoiceId;
        this.invoiceDate = invoiceDate;
        this.dueDate = dueDate;
        this.periodStartDate = periodStartDate;
        this.periodEndDate = periodEndDate;
        this.totalAmount = totalAmount;
        this.vendorId = vendorId;
    }

    public String getInvoiceId() {
        return invoiceId;
    }

    public LocalDate getInvoiceDate() {
        return invoiceDate;
    }

    public LocalDate getDueDate() {
        return dueDate;
    }

    public LocalDate getPeriodStartDate() {
        return periodStartDate;
    }

    public LocalDate getPeriodEndDate() {
        return periodEndDate;
    }

    public BigDecimal getTotalAmount() {
        return totalAmount;
    }

    public String getVendorId() {
        return vendorId;
    }

    @Override
    public String toString() {
        return "Invoice{" +
                "invoiceId='" + invoiceId + '\'' +
                ", invoiceDate=" + invoiceDate +
                ", totalAmount=" + totalAmount +
                ", vendorId='" + vendorId + '\'' +
                '}';
    }
}
