package com.payshield.gleaner.domain.detection;

import com.payshield.gleaner.domain.Glean;
import com.payshield.gleaner.domain.GleanLocation;
import com.payshield.gleaner.domain.GleanType;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static com.payshield.gleaner.domain.detection.Invoices.VENDOR;
import static com.payshield.gleaner.domain.detection.Invoices.invoice;
import static org.assertj.core.api.Assertions.assertThat;

class VendorNotSeenDetectorTest {

    private final VendorNotSeenDetector detector = new VendorNotSeenDetector();

    @Test
    void flagsInvoiceAfterLongGap() {
        detector.observe(invoice("test_id_1", LocalDate.of(2020, 1, 1)));
        List<Glean> gleans = detector.observe(invoice("test_id_2", LocalDate.of(2020, 4, 1)));

        assertThat(gleans).hasSize(1);
        Glean glean = gleans.get(0);
        assertThat(glean.text()).isEqualTo("First new bill in 3 months from vendor " + VENDOR);
        assertThat(glean.type()).isEqualTo(GleanType.VENDOR_NOT_SEEN_IN_A_WHILE);
        assertThat(glean.location()).isEqualTo(GleanLocation.INVOICE);
        assertThat(glean.invoiceId()).isEqualTo("test_id_2");
        assertThat(glean.emissionDate()).isEqualTo(LocalDate.of(2020, 4, 1));
    }

    @Test
    void ignoresRegularInvoices() {
        assertThat(detector.observe(invoice("test_id_1", LocalDate.of(2020, 1, 1)))).isEmpty();
        assertThat(detector.observe(invoice("test_id_2", LocalDate.of(2020, 2, 1)))).isEmpty();
    }

    @Test
    void ninetyDayGapIsNotFlagged() {
        detector.observe(invoice("test_id_1", LocalDate.of(2020, 1, 1)));

        assertThat(detector.observe(invoice("test_id_2", LocalDate.of(2020, 3, 31)))).isEmpty();
    }

    @Test
    void comparesEachInvoiceWithItsPredecessor() {
        List<Glean> gleans = new ArrayList<>();
        gleans.addAll(detector.observe(invoice("a", LocalDate.of(2019, 1, 1))));
        gleans.addAll(detector.observe(invoice("b", LocalDate.of(2019, 12, 1))));
        gleans.addAll(detector.observe(invoice("c", LocalDate.of(2019, 12, 20))));
        gleans.addAll(detector.observe(invoice("d", LocalDate.of(2020, 6, 1))));

        assertThat(gleans).extracting(Glean::invoiceId).containsExactly("b", "d");
        assertThat(gleans.get(0).text()).startsWith("First new bill in 11 months");
        assertThat(gleans.get(1).text()).startsWith("First new bill in 5 months");
    }
}
