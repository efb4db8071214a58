package com.payshield.gleaner.application;

import com.payshield.gleaner.domain.DetectionEngine;
import com.payshield.gleaner.domain.Glean;
import com.payshield.gleaner.domain.GleanRecord;
import com.payshield.gleaner.domain.GleanType;
import com.payshield.gleaner.domain.Invoice;
import com.payshield.gleaner.domain.LineItem;
import com.payshield.gleaner.domain.ports.GleanExportPort;
import com.payshield.gleaner.domain.ports.GleanRepository;
import com.payshield.gleaner.domain.ports.InvoiceSource;
import com.payshield.gleaner.domain.ports.NotifierPort;
import com.payshield.gleaner.exception.GleanDetectionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Partitions the input by vendor and by invoice, runs every group on the worker pool and hands
 * the merged gleans to the output ports.
 */
@Service
public class DetectionOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(DetectionOrchestrator.class);

    private final InvoiceSource source;
    private final GleanRepository gleans;
    private final GleanExportPort exporter;
    private final NotifierPort notifier;
    private final DetectionEngine engine;
    private final ExecutorService executor;
    private final Clock clock;

    public DetectionOrchestrator(InvoiceSource source, GleanRepository gleans, GleanExportPort exporter,
                                 NotifierPort notifier, DetectionEngine engine, ExecutorService detectionExecutor,
                                 Clock clock) {
        this.source = source;
        this.gleans = gleans;
        this.exporter = exporter;
        this.notifier = notifier;
        this.engine = engine;
        this.executor = detectionExecutor;
        this.clock = clock;
    }

    public DetectionRun run() {
        UUID runId = UUID.randomUUID();
        LocalDate asOf = LocalDate.now(clock);
        log.info("Starting glean detection run {} as of {}", runId, asOf);

        List<Invoice> invoices = source.loadInvoices();
        List<LineItem> lineItems = source.loadLineItems();
        log.info("Loaded {} invoices and {} line items", invoices.size(), lineItems.size());

        List<Glean> detected = detect(invoices, lineItems, asOf);

        List<GleanRecord> records = new ArrayList<>(detected.size());
        for (Glean glean : detected) {
            records.add(new GleanRecord(UUID.randomUUID(), glean));
        }
        // committed before the export is written
        gleans.saveAll(runId, records);
        Optional<Path> exported = exporter.export(records);
        exported.ifPresent(path -> log.info("Run {} exported to {}", runId, path));

        Map<GleanType, Long> counts = countByType(detected);
        DetectionRun run = new DetectionRun(runId, asOf, records.size(), counts);

        try {
            notifier.sendRunCompleted(runId, summary(run));
        } catch (Exception e) {
            log.error("Failed to send run summary for {}: {}", runId, e.getMessage(), e);
            // the gleans are stored, a failed notification does not fail the run
        }

        log.info("Glean detection run {} completed - {} gleans {}", runId, records.size(), counts);
        return run;
    }

    /**
     * Runs all detectors over the given records.
     *
     * <p>Vendor groups are merged in vendor id order, followed by accrual results in invoice id order,
     * so identical input always gives identical output.
     *
     * @param asOf the date the final overdue check of each vendor runs against
     */
    public List<Glean> detect(Collection<Invoice> invoices, Collection<LineItem> lineItems, LocalDate asOf) {
        Map<String, List<Invoice>> byVendor = new TreeMap<>();
        Map<String, List<Invoice>> byInvoiceId = new HashMap<>();
        for (Invoice invoice : invoices) {
            if (invoice.getInvoiceDate() == null) {
                log.debug("Skipping invoice {} without an invoice date", invoice.getInvoiceId());
                continue;
            }
            byVendor.computeIfAbsent(invoice.getVendorId(), k -> new ArrayList<>()).add(invoice);
            byInvoiceId.computeIfAbsent(invoice.getInvoiceId(), k -> new ArrayList<>()).add(invoice);
        }

        Map<String, List<LineItem>> itemsByInvoice = new TreeMap<>();
        for (LineItem item : lineItems) {
            itemsByInvoice.computeIfAbsent(item.getInvoiceId(), k -> new ArrayList<>()).add(item);
        }

        Map<String, Future<List<Glean>>> tasks = new LinkedHashMap<>();
        byVendor.forEach((vendorId, group) ->
                tasks.put("vendor:" + vendorId, submit(() -> engine.detectVendor(vendorId, group, asOf))));

        int joined = 0;
        for (Map.Entry<String, List<LineItem>> entry : itemsByInvoice.entrySet()) {
            List<Invoice> matches = byInvoiceId.get(entry.getKey());
            if (matches == null) {
                log.debug("Dropping {} line items of unknown or undated invoice {}",
                        entry.getValue().size(), entry.getKey());
                continue;
            }
            List<LineItem> items = entry.getValue();
            tasks.put("invoice:" + entry.getKey(), submit(() -> {
                List<Glean> out = new ArrayList<>();
                for (Invoice invoice : matches) {
                    out.addAll(engine.detectInvoice(invoice, items));
                }
                return out;
            }));
            joined++;
        }
        log.info("Dispatched {} vendor groups and {} invoice groups", byVendor.size(), joined);

        List<Glean> merged = new ArrayList<>();
        for (Map.Entry<String, Future<List<Glean>>> task : tasks.entrySet()) {
            merged.addAll(await(task.getKey(), task.getValue(), tasks.values()));
        }
        return merged;
    }

    private Future<List<Glean>> submit(Callable<List<Glean>> task) {
        return executor.submit(task);
    }

    private List<Glean> await(String group, Future<List<Glean>> future, Collection<Future<List<Glean>>> all) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            all.forEach(f -> f.cancel(true));
            throw new GleanDetectionException("Interrupted while waiting for group " + group, e);
        } catch (ExecutionException e) {
            all.forEach(f -> f.cancel(true));
            log.error("Detection failed for group {}: {}", group, e.getCause().getMessage(), e.getCause());
            throw new GleanDetectionException("Detection failed for group " + group, e.getCause());
        }
    }

    private static Map<GleanType, Long> countByType(List<Glean> detected) {
        Map<GleanType, Long> counts = new EnumMap<>(GleanType.class);
        for (Glean glean : detected) {
            counts.merge(glean.type(), 1L, Long::sum);
        }
        return counts;
    }

    private static Map<String, Object> summary(DetectionRun run) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("runId", run.runId().toString());
        payload.put("asOf", run.asOf().toString());
        payload.put("total", run.total());
        Map<String, Long> byType = new LinkedHashMap<>();
        run.countsByType().forEach((type, count) -> byType.put(type.code(), count));
        payload.put("countsByType", byType);
        return payload;
    }

    public record DetectionRun(UUID runId, LocalDate asOf, long total, Map<GleanType, Long> countsByType) {}
}
