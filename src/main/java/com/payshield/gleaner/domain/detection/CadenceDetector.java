package com.payshield.gleaner.domain.detection;

import com.payshield.gleaner.domain.CalendarMath;
import com.payshield.gleaner.domain.Glean;
import com.payshield.gleaner.domain.GleanType;
import com.payshield.gleaner.domain.Invoice;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Learns the day a vendor usually invoices, per month and per quarter, and reports every day an
 * expected invoice is overdue.
 *
 * <p>Each invoice is first judged against the history built from the invoices before it, then added
 * to that history. {@link #flush(LocalDate)} judges the final history against the run date, so a
 * vendor that is currently late is reported as well as the gaps in its past.
 *
 * <p>One overdue period produces one glean per day, from the expected date up to the end of that
 * month or the day before the reference date, whichever comes first.
 */
public class CadenceDetector implements VendorDetector {

    private static final Logger log = LoggerFactory.getLogger(CadenceDetector.class);

    static final int MIN_MONTHS_FOR_PATTERN = 3;
    static final int MIN_QUARTERS_FOR_PATTERN = 2;

    private final List<MonthEntry> monthlyHistory = new ArrayList<>();
    private final List<QuarterEntry> quarterlyHistory = new ArrayList<>();
    private final String vendorId;

    public CadenceDetector(String vendorId) {
        this.vendorId = vendorId;
    }

    @Override
    public List<Glean> observe(Invoice invoice) {
        List<Glean> gleans = warn(invoice.getInvoiceDate());
        recordMonth(invoice.getInvoiceDate());
        recordQuarter(invoice.getInvoiceDate());
        return gleans;
    }

    @Override
    public List<Glean> flush(LocalDate asOf) {
        return warn(asOf);
    }

    private List<Glean> warn(LocalDate reference) {
        List<Glean> gleans = new ArrayList<>();
        gleans.addAll(warnMonthly(reference));
        gleans.addAll(warnQuarterly(reference));
        return gleans;
    }

    List<Glean> warnMonthly(LocalDate reference) {
        if (monthlyHistory.size() < MIN_MONTHS_FOR_PATTERN) {
            return List.of();
        }
        LocalDate lastMonth = lastMonth().month();
        if (lastMonth.equals(CalendarMath.monthStart(reference))) {
            return List.of();
        }

        FrequencyTable<Integer> days = new FrequencyTable<>();
        for (MonthEntry entry : monthlyHistory) {
            days.addAll(entry.days());
        }
        int usualDay = days.usualKey();
        LocalDate expected = CalendarMath.plusMonthsOnDay(lastMonth, 1, usualDay);
        return overdueDays(usualDay, expected, reference);
    }

    List<Glean> warnQuarterly(LocalDate reference) {
        if (quarterlyHistory.size() < MIN_QUARTERS_FOR_PATTERN) {
            return List.of();
        }
        LocalDate lastQuarter = lastQuarter().quarter();
        if (lastQuarter.equals(CalendarMath.quarterStart(reference))) {
            return List.of();
        }

        FrequencyTable<QuarterSlot> slots = new FrequencyTable<>();
        for (QuarterEntry entry : quarterlyHistory) {
            slots.increment(entry.slot());
        }
        QuarterSlot usual = slots.usualKey();
        LocalDate expected = CalendarMath.plusMonthsOnDay(
                CalendarMath.nextQuarterStart(lastQuarter), usual.monthOffset(), usual.day());
        return overdueDays(usual.day(), expected, reference);
    }

    private List<Glean> overdueDays(int usualDay, LocalDate expected, LocalDate reference) {
        if (!expected.isBefore(reference)) {
            return List.of();
        }

        String text = String.format("%s generally charges between on %d day of each month invoices are sent. "
                + "On %s, an invoice from %s has not been received", vendorId, usualDay, expected, vendorId);
        List<Glean> gleans = new ArrayList<>();
        for (LocalDate day = expected;
             CalendarMath.isSameMonth(day, expected) && day.isBefore(reference);
             day = day.plusDays(1)) {
            gleans.add(Glean.forVendor(day, text, GleanType.NO_INVOICE_RECEIVED, null, vendorId));
        }
        log.debug("Vendor {} expected an invoice on {}, {} overdue days before {}", vendorId, expected,
                gleans.size(), reference);
        return gleans;
    }

    private void recordMonth(LocalDate invoiceDate) {
        LocalDate month = CalendarMath.monthStart(invoiceDate);
        MonthEntry current = null;
        if (!monthlyHistory.isEmpty()) {
            MonthEntry last = lastMonth();
            if (last.month().equals(month)) {
                current = last;
            } else if (last.month().isBefore(CalendarMath.previousMonthStart(month))) {
                // a whole month was skipped, the pattern has to be learned again
                monthlyHistory.clear();
            }
        }
        if (current == null) {
            current = new MonthEntry(month, new FrequencyTable<>());
            monthlyHistory.add(current);
        }
        current.days().increment(invoiceDate.getDayOfMonth());
    }

    private void recordQuarter(LocalDate invoiceDate) {
        LocalDate quarter = CalendarMath.quarterStart(invoiceDate);
        if (!quarterlyHistory.isEmpty()) {
            LocalDate lastQuarter = lastQuarter().quarter();
            if (!CalendarMath.nextQuarterStart(lastQuarter).equals(quarter)) {
                quarterlyHistory.clear();
                if (lastQuarter.equals(quarter)) {
                    // not the first invoice of this quarter, nothing to record
                    return;
                }
            }
        }
        QuarterSlot slot = new QuarterSlot(invoiceDate.getMonthValue() - quarter.getMonthValue(),
                invoiceDate.getDayOfMonth());
        quarterlyHistory.add(new QuarterEntry(quarter, slot));
    }

    private MonthEntry lastMonth() {
        return monthlyHistory.get(monthlyHistory.size() - 1);
    }

    private QuarterEntry lastQuarter() {
        return quarterlyHistory.get(quarterlyHistory.size() - 1);
    }

    int trackedMonths() {
        return monthlyHistory.size();
    }

    int trackedQuarters() {
        return quarterlyHistory.size();
    }

    private record MonthEntry(LocalDate month, FrequencyTable<Integer> days) {
    }

    private record QuarterEntry(LocalDate quarter, QuarterSlot slot) {
    }
}
