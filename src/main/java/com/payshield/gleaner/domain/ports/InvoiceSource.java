package com.payshield.gleaner.domain.ports;

import com.payshield.gleaner.domain.Invoice;
import com.payshield.gleaner.domain.LineItem;

import java.util.List;

public interface InvoiceSource {

    /** Invoices that carry an invoice date. Undated invoices are dropped by the source. */
    List<Invoice> loadInvoices();

    List<LineItem> loadLineItems();
}
