package com.payshield.gleaner.domain;

import java.math.BigDecimal;
import java.time.LocalDate;

public class LineItem {

    private final String invoiceId;
    private final String lineItemId;
    private final LocalDate periodStartDate;
    private final LocalDate periodEndDate;
    private final BigDecimal totalAmount;
    private final String canonicalLineItemId;

    public LineItem(String invoiceId, String lineItemId, LocalDate periodStartDate, LocalDate periodEndDate,
                    BigDecimal totalAmount, String canonicalLineItemId) {
        this.invoiceId = invoiceId;
        this.lineItemId = lineItemId;
        this.periodStartDate = periodStartDate;
        this.periodEndDate = periodEndDate;
        this.totalAmount = totalAmount;
        this.canonicalLineItemId = canonicalLineItemId;
    }

    public String getInvoiceId() {
        return invoiceId;
    }

    public String getLineItemId() {
        return lineItemId;
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

    public String getCanonicalLineItemId() {
        return canonicalLineItemId;
    }
}
