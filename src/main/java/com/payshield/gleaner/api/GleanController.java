package com.payshield.gleaner.api;

import com.payshield.gleaner.api.dto.GleanResponse;
import com.payshield.gleaner.application.DetectionOrchestrator;
import com.payshield.gleaner.domain.GleanRecord;
import com.payshield.gleaner.domain.ports.GleanRepository;
import com.payshield.gleaner.exception.InvoiceDataException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/gleans")
@Tag(name = "Gleans", description = "Run anomaly detection over the invoice history and browse the alerts")
public class GleanController {

    private static final Logger log = LoggerFactory.getLogger(GleanController.class);
    private static final int MAX_PAGE_SIZE = 500;

    private final DetectionOrchestrator orchestrator;
    private final GleanRepository gleans;

    public GleanController(DetectionOrchestrator orchestrator, GleanRepository gleans) {
        this.orchestrator = orchestrator;
        this.gleans = gleans;
    }

    @PostMapping("/runs")
    @Operation(summary = "Run detection",
            description = "Recomputes all gleans over the configured invoice and line item files and stores them")
    public ResponseEntity<?> run() {
        log.info("Detection run requested");
        try {
            DetectionOrchestrator.DetectionRun run = orchestrator.run();

            Map<String, Long> counts = new LinkedHashMap<>();
            run.countsByType().forEach((type, count) -> counts.put(type.code(), count));

            Map<String, Object> body = new LinkedHashMap<>();
            body.put("runId", run.runId().toString());
            body.put("asOf", run.asOf().toString());
            body.put("total", run.total());
            body.put("countsByType", counts);
            return ResponseEntity.ok(body);
        } catch (InvoiceDataException e) {
            log.error("Detection run rejected input: {}", e.getMessage());
            return ResponseEntity.badRequest().body(Map.of(
                    "error", "Invalid input data",
                    "message", e.getMessage()
            ));
        } catch (Exception e) {
            log.error("Detection run failed: {}", e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of(
                    "error", "Detection failed",
                    "message", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()
            ));
        }
    }

    @GetMapping
    @Operation(summary = "List gleans", description = "Stored gleans ordered by date, optionally for one vendor")
    public ResponseEntity<?> list(@Parameter(description = "Canonical vendor id")
                                  @RequestParam(required = false) String vendorId,
                                  @RequestParam(defaultValue = "0") int page,
                                  @RequestParam(defaultValue = "50") int size) {
        if (page < 0 || size < 1 || size > MAX_PAGE_SIZE) {
            return ResponseEntity.badRequest().body(Map.of(
                    "error", "Invalid paging",
                    "message", "page must be >= 0 and size between 1 and " + MAX_PAGE_SIZE
            ));
        }

        List<GleanRecord> records = vendorId == null || vendorId.isBlank()
                ? gleans.findAll(page, size)
                : gleans.findByVendor(vendorId, page, size);
        List<GleanResponse> items = records.stream().map(GleanResponse::from).toList();
        return ResponseEntity.ok(Map.of(
                "page", page,
                "size", size,
                "items", items
        ));
    }
}
