package com.payshield.gleaner.infrastructure.csv;

import com.payshield.gleaner.config.AppProperties;
import com.payshield.gleaner.domain.Glean;
import com.payshield.gleaner.domain.GleanRecord;
import com.payshield.gleaner.domain.ports.GleanExportPort;
import com.payshield.gleaner.exception.GleanDetectionException;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

@Component
public class CsvGleanExporter implements GleanExportPort {

    private static final Logger log = LoggerFactory.getLogger(CsvGleanExporter.class);

    static final String[] HEADER = {
            "glean_id", "glean_date", "glean_text", "glean_type", "glean_location", "invoice_id",
            "canonical_vendor_id"
    };

    private static final CSVFormat FORMAT = CSVFormat.RFC4180.builder()
            .setHeader(HEADER)
            .setRecordSeparator("\n")
            .build();

    private final AppProperties props;

    public CsvGleanExporter(AppProperties props) {
        this.props = props;
    }

    @Override
    public Optional<Path> export(List<GleanRecord> gleans) {
        String configured = props.getOutput().getGleansPath();
        if (configured == null || configured.isBlank()) {
            log.debug("Glean CSV export disabled");
            return Optional.empty();
        }

        Path file = Path.of(configured);
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                 CSVPrinter printer = new CSVPrinter(writer, FORMAT)) {
                for (GleanRecord record : gleans) {
                    Glean g = record.glean();
                    printer.printRecord(
                            record.gleanId(),
                            g.emissionDate(),
                            g.text(),
                            g.type().code(),
                            g.location().code(),
                            g.invoiceId(),
                            g.vendorId());
                }
            }
        } catch (IOException e) {
            throw new GleanDetectionException("Could not write gleans to " + file, e);
        }

        log.info("Wrote {} gleans to {}", gleans.size(), file);
        return Optional.of(file);
    }
}
