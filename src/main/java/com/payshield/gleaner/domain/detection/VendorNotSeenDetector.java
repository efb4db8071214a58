package com.payshield.gleaner.domain.detection;

import com.payshield.gleaner.domain.CalendarMath;
import com.payshield.gleaner.domain.Glean;
import com.payshield.gleaner.domain.GleanType;
import com.payshield.gleaner.domain.Invoice;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

public class VendorNotSeenDetector implements VendorDetector {

    private static final Logger log = LoggerFactory.getLogger(VendorNotSeenDetector.class);

    private static final long MAX_GAP_DAYS = 90;
    private static final long DAYS_PER_MONTH = 30;

    private Invoice previous;

    @Override
    public List<Glean> observe(Invoice invoice) {
        Invoice last = previous;
        previous = invoice;
        if (last == null) {
            return List.of();
        }

        long gap = CalendarMath.daysBetween(last.getInvoiceDate(), invoice.getInvoiceDate());
        if (gap <= MAX_GAP_DAYS) {
            return List.of();
        }

        log.debug("Vendor {} returned after {} days with invoice {}", invoice.getVendorId(), gap, invoice.getInvoiceId());
        String text = String.format("First new bill in %d months from vendor %s",
                gap / DAYS_PER_MONTH, invoice.getVendorId());
        return List.of(Glean.forInvoice(invoice.getInvoiceDate(), text, GleanType.VENDOR_NOT_SEEN_IN_A_WHILE,
                invoice.getInvoiceId(), invoice.getVendorId()));
    }
}
