package com.payshield.gleaner.infrastructure.csv;

import com.payshield.gleaner.config.AppProperties;
import com.payshield.gleaner.domain.Invoice;
import com.payshield.gleaner.domain.LineItem;
import com.payshield.gleaner.domain.ports.InvoiceSource;
import com.payshield.gleaner.exception.InvoiceDataException;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Reads {@code invoice.csv} and {@code line_item.csv} exports. Both files carry a header row;
 * empty cells are read as null.
 */
@Component
public class CsvInvoiceSource implements InvoiceSource {

    private static final Logger log = LoggerFactory.getLogger(CsvInvoiceSource.class);

    private static final CSVFormat FORMAT = CSVFormat.RFC4180.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreEmptyLines(true)
            .setTrim(true)
            .build();

    static final List<String> INVOICE_COLUMNS = List.of(
            "invoice_id", "invoice_date", "due_date", "period_start_date", "period_end_date",
            "total_amount", "canonical_vendor_id");
    static final List<String> LINE_ITEM_COLUMNS = List.of(
            "invoice_id", "line_item_id", "period_start_date", "period_end_date",
            "total_amount", "canonical_line_item_id");

    private final AppProperties props;

    public CsvInvoiceSource(AppProperties props) {
        this.props = props;
    }

    @Override
    public List<Invoice> loadInvoices() {
        Path path = Path.of(props.getData().getInvoicesPath());
        List<Invoice> all = read(path, INVOICE_COLUMNS, this::toInvoice);
        List<Invoice> dated = new ArrayList<>(all.size());
        for (Invoice invoice : all) {
            if (invoice.getInvoiceDate() == null) {
                log.debug("Dropping invoice {} without invoice_date", invoice.getInvoiceId());
                continue;
            }
            dated.add(invoice);
        }
        log.info("Read {} invoices from {} ({} without invoice_date dropped)",
                dated.size(), path, all.size() - dated.size());
        return dated;
    }

    @Override
    public List<LineItem> loadLineItems() {
        Path path = Path.of(props.getData().getLineItemsPath());
        List<LineItem> items = read(path, LINE_ITEM_COLUMNS, this::toLineItem);
        log.info("Read {} line items from {}", items.size(), path);
        return items;
    }

    private <T> List<T> read(Path path, List<String> columns, Function<CSVRecord, T> mapper) {
        if (!Files.isRegularFile(path)) {
            throw new InvoiceDataException("Input file not found: " + path);
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             CSVParser parser = FORMAT.parse(reader)) {
            List<String> missing = columns.stream()
                    .filter(column -> !parser.getHeaderMap().containsKey(column))
                    .toList();
            if (!missing.isEmpty()) {
                throw new InvoiceDataException("Missing columns " + missing + " in " + path);
            }

            List<T> out = new ArrayList<>();
            for (CSVRecord record : parser) {
                try {
                    out.add(mapper.apply(record));
                } catch (DateTimeParseException | IllegalArgumentException e) {
                    throw new InvoiceDataException(String.format("Malformed value in %s record %d: %s",
                            path, record.getRecordNumber(), e.getMessage()), e);
                }
            }
            return out;
        } catch (IOException e) {
            throw new InvoiceDataException("Could not read " + path, e);
        }
    }

    private Invoice toInvoice(CSVRecord r) {
        return new Invoice(
                required(r, "invoice_id"),
                date(r, "invoice_date"),
                date(r, "due_date"),
                date(r, "period_start_date"),
                date(r, "period_end_date"),
                amount(r, "total_amount"),
                required(r, "canonical_vendor_id"));
    }

    private LineItem toLineItem(CSVRecord r) {
        return new LineItem(
                required(r, "invoice_id"),
                required(r, "line_item_id"),
                date(r, "period_start_date"),
                date(r, "period_end_date"),
                amount(r, "total_amount"),
                r.get("canonical_line_item_id"));
    }

    private static String required(CSVRecord r, String column) {
        String value = r.get(column);
        if (value == null || value.isEmpty()) {
            throw new InvoiceDataException(String.format("Missing %s in record %d", column, r.getRecordNumber()));
        }
        return value;
    }

    private static LocalDate date(CSVRecord r, String column) {
        String value = r.get(column);
        return value == null || value.isEmpty() ? null : LocalDate.parse(value);
    }

    private static BigDecimal amount(CSVRecord r, String column) {
        return new BigDecimal(required(r, column)).setScale(2, RoundingMode.HALF_EVEN);
    }
}
