package com.payshield.gleaner.domain.detection;

import com.payshield.gleaner.domain.Invoice;

import java.math.BigDecimal;
import java.time.LocalDate;

final class Invoices {

    static final String VENDOR = "test_vendor_id";

    private Invoices() {
    }

    static Invoice invoice(String id, LocalDate date) {
        return invoice(id, date, "0.00");
    }

    static Invoice invoice(String id, LocalDate date, String amount) {
        return new Invoice(id, date, date.plusMonths(1), date, null, new BigDecimal(amount), VENDOR);
    }

    static Invoice invoiceWithPeriodEnd(String id, LocalDate date, LocalDate periodEnd) {
        return new Invoice(id, date, date.plusMonths(1), date, periodEnd, new BigDecimal("10.00"), VENDOR);
    }
}
