package com.payshield.gleaner.domain.detection;

import com.payshield.gleaner.domain.CalendarMath;
import com.payshield.gleaner.domain.Glean;
import com.payshield.gleaner.domain.GleanType;
import com.payshield.gleaner.domain.Invoice;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Compares a vendor's month-to-date spend against the average of the trailing twelve months.
 * The average always divides by twelve, so vendors with a short history ramp up slowly.
 */
public class SpendIncreaseDetector implements VendorDetector {

    private static final Logger log = LoggerFactory.getLogger(SpendIncreaseDetector.class);

    private static final BigDecimal MONTHS_IN_WINDOW = BigDecimal.valueOf(12);

    // Spend tiers, checked from the top. Smaller months need a larger multiple of the average.
    private static final BigDecimal HIGH_SPEND = new BigDecimal("10000");
    private static final BigDecimal MEDIUM_SPEND = new BigDecimal("1000");
    private static final BigDecimal LOW_SPEND = new BigDecimal("100");
    private static final BigDecimal HIGH_MULTIPLIER = new BigDecimal("1.5");
    private static final BigDecimal MEDIUM_MULTIPLIER = new BigDecimal("3.0");
    private static final BigDecimal LOW_MULTIPLIER = new BigDecimal("6.0");

    private final Deque<MonthSpend> history = new ArrayDeque<>();
    private BigDecimal historyTotal = BigDecimal.ZERO;
    private LocalDate currentMonth = LocalDate.MIN;
    private BigDecimal currentMonthSpend = BigDecimal.ZERO;

    @Override
    public List<Glean> observe(Invoice invoice) {
        LocalDate month = CalendarMath.monthStart(invoice.getInvoiceDate());

        if (month.isAfter(currentMonth)) {
            history.addLast(new MonthSpend(currentMonth, currentMonthSpend));
            historyTotal = historyTotal.add(currentMonthSpend);
            currentMonth = month;
            currentMonthSpend = BigDecimal.ZERO;
        }

        while (!history.isEmpty() && !history.peekFirst().month().plusYears(1).isAfter(month)) {
            MonthSpend evicted = history.removeFirst();
            historyTotal = historyTotal.subtract(evicted.spend());
        }

        currentMonthSpend = currentMonthSpend.add(invoice.getTotalAmount());
        BigDecimal average = historyTotal.divide(MONTHS_IN_WINDOW, MathContext.DECIMAL128);

        if (!isTriggered(currentMonthSpend, average)) {
            return List.of();
        }

        BigDecimal increase = currentMonthSpend.subtract(average);
        BigDecimal rate = increase.divide(average, MathContext.DECIMAL128);
        log.debug("Vendor {} month {} spend {} against average {}", invoice.getVendorId(), month,
                currentMonthSpend, average);

        String text = String.format("Monthly spend with %s is %s (%s%%) higher than average",
                invoice.getVendorId(),
                increase.setScale(2, RoundingMode.HALF_EVEN).toPlainString(),
                rate.movePointRight(2).setScale(0, RoundingMode.HALF_EVEN).toPlainString());
        return List.of(Glean.forVendor(invoice.getInvoiceDate(), text, GleanType.LARGE_MONTH_INCREASE_MTD,
                invoice.getInvoiceId(), invoice.getVendorId()));
    }

    static boolean isTriggered(BigDecimal spend, BigDecimal average) {
        if (average.signum() == 0) {
            return false;
        }
        if (spend.compareTo(HIGH_SPEND) > 0) {
            return spend.compareTo(average.multiply(HIGH_MULTIPLIER)) > 0;
        }
        if (spend.compareTo(MEDIUM_SPEND) > 0) {
            return spend.compareTo(average.multiply(MEDIUM_MULTIPLIER)) > 0;
        }
        if (spend.compareTo(LOW_SPEND) > 0) {
            return spend.compareTo(average.multiply(LOW_MULTIPLIER)) > 0;
        }
        return false;
    }

    private record MonthSpend(LocalDate month, BigDecimal spend) {
    }
}
