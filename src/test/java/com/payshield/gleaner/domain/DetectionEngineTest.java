package com.payshield.gleaner.domain;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DetectionEngineTest {

    private final DetectionEngine engine = new DetectionEngine();

    @Test
    void sortsVendorInvoicesBeforeDetecting() {
        List<Invoice> shuffled = List.of(
                invoice("c", LocalDate.of(2020, 3, 25)),
                invoice("a", LocalDate.of(2020, 1, 25)),
                invoice("b", LocalDate.of(2020, 2, 25)));

        List<Glean> gleans = engine.detectVendor("vendor-a", shuffled, LocalDate.of(2020, 5, 1));

        assertThat(gleans).hasSize(6)
                .allMatch(glean -> glean.type() == GleanType.NO_INVOICE_RECEIVED);
        assertThat(gleans.get(0).emissionDate()).isEqualTo(LocalDate.of(2020, 4, 25));
    }

    @Test
    void groupsOutputByDetector() {
        List<Invoice> invoices = List.of(
                invoice("a", LocalDate.of(2019, 1, 1), "2400"),
                invoice("b", LocalDate.of(2019, 6, 1), "2000"));

        List<Glean> gleans = engine.detectVendor("vendor-a", invoices, LocalDate.of(2019, 6, 2));

        assertThat(gleans).extracting(Glean::type).containsExactly(
                GleanType.VENDOR_NOT_SEEN_IN_A_WHILE, GleanType.LARGE_MONTH_INCREASE_MTD);
    }

    @Test
    void accrualUsesJoinedLineItems() {
        Invoice invoice = invoice("a", LocalDate.of(2020, 1, 1));
        LineItem item = new LineItem("a", "li", null, LocalDate.of(2020, 6, 1), BigDecimal.ONE, null);

        assertThat(engine.detectInvoice(invoice, List.of(item)))
                .extracting(Glean::type)
                .containsExactly(GleanType.ACCRUAL_ALERT);
        assertThat(engine.detectInvoice(invoice, List.of())).isEmpty();
    }

    private static Invoice invoice(String id, LocalDate date) {
        return invoice(id, date, "10.00");
    }

    private static Invoice invoice(String id, LocalDate date, String amount) {
        return new Invoice(id, date, null, null, null, new BigDecimal(amount), "vendor-a");
    }
}
