package com.payshield.gleaner.domain.detection;

import com.payshield.gleaner.domain.CalendarMath;
import com.payshield.gleaner.domain.Glean;
import com.payshield.gleaner.domain.GleanType;
import com.payshield.gleaner.domain.Invoice;
import com.payshield.gleaner.domain.LineItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Flags invoices whose service periods (on the invoice or any of its line items) end more
 * than 90 days after the invoice was issued.
 */
public class AccrualDetector {

    private static final Logger log = LoggerFactory.getLogger(AccrualDetector.class);

    private static final long MAX_COVERAGE_DAYS = 90;

    public List<Glean> evaluate(Invoice invoice, Collection<LineItem> lineItems) {
        Optional<LocalDate> maxEnd = Stream.concat(
                        lineItems.stream().map(LineItem::getPeriodEndDate),
                        Stream.of(invoice.getPeriodEndDate()))
                .filter(Objects::nonNull)
                .max(LocalDate::compareTo);

        if (maxEnd.isEmpty()) {
            log.debug("Invoice {} has no period end dates, skipping accrual check", invoice.getInvoiceId());
            return List.of();
        }

        LocalDate end = maxEnd.get();
        if (CalendarMath.daysBetween(invoice.getInvoiceDate(), end) <= MAX_COVERAGE_DAYS) {
            return List.of();
        }

        String text = String.format("Line items from vendor %s in this invoice cover future periods (through %s)",
                invoice.getVendorId(), end);
        return List.of(Glean.forInvoice(invoice.getInvoiceDate(), text, GleanType.ACCRUAL_ALERT,
                invoice.getInvoiceId(), invoice.getVendorId()));
    }
}
