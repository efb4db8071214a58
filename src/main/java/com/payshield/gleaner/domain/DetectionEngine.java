package com.payshield.gleaner.domain;

import com.payshield.gleaner.domain.detection.AccrualDetector;
import com.payshield.gleaner.domain.detection.CadenceDetector;
import com.payshield.gleaner.domain.detection.SpendIncreaseDetector;
import com.payshield.gleaner.domain.detection.VendorDetector;
import com.payshield.gleaner.domain.detection.VendorNotSeenDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Runs the detectors over one group of records. Stateless; every call builds fresh detectors, so a
 * single engine can serve any number of worker threads.
 */
public class DetectionEngine {

    private static final Logger log = LoggerFactory.getLogger(DetectionEngine.class);

    private final AccrualDetector accrualDetector = new AccrualDetector();

    /**
     * Runs the per-vendor detectors over all dated invoices of one vendor.
     *
     * @param vendorId canonical vendor id shared by all {@code invoices}
     * @param invoices the vendor's invoices, in any order
     * @param asOf     the run's current date, used for the final overdue check
     */
    public List<Glean> detectVendor(String vendorId, Collection<Invoice> invoices, LocalDate asOf) {
        List<Invoice> sorted = new ArrayList<>(invoices);
        sorted.sort(Comparator.comparing(Invoice::getInvoiceDate));

        List<VendorDetector> detectors = List.of(
                new VendorNotSeenDetector(),
                new SpendIncreaseDetector(),
                new CadenceDetector(vendorId));

        List<Glean> gleans = new ArrayList<>();
        for (VendorDetector detector : detectors) {
            for (Invoice invoice : sorted) {
                gleans.addAll(detector.observe(invoice));
            }
            gleans.addAll(detector.flush(asOf));
        }

        log.debug("Vendor {} - {} invoices, {} gleans", vendorId, sorted.size(), gleans.size());
        return gleans;
    }

    /**
     * Runs the accrual check on one invoice joined with its line items.
     */
    public List<Glean> detectInvoice(Invoice invoice, Collection<LineItem> lineItems) {
        return accrualDetector.evaluate(invoice, lineItems);
    }
}
