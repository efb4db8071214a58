package com.payshield.gleaner.domain.detection;

import com.payshield.gleaner.domain.Glean;
import com.payshield.gleaner.domain.Invoice;

import java.time.LocalDate;
import java.util.List;

/**
 * A detector that walks one vendor's invoices in non-decreasing invoice date order.
 * Instances hold per-vendor history and must not be shared across vendors.
 */
public interface VendorDetector {

    List<Glean> observe(Invoice invoice);

    /**
     * Called once after the last invoice of the vendor.
     *
     * @param asOf the run's current date
     */
    default List<Glean> flush(LocalDate asOf) {
        return List.of();
    }
}
