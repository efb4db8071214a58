package com.payshield.gleaner.infrastructure.csv;

import com.payshield.gleaner.config.AppProperties;
import com.payshield.gleaner.domain.Glean;
import com.payshield.gleaner.domain.GleanRecord;
import com.payshield.gleaner.domain.GleanType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class CsvGleanExporterTest {

    @TempDir
    Path dir;

    @Test
    void writesHeaderAndOneRowPerGlean() throws IOException {
        Path target = dir.resolve("out/gleans.csv");
        AppProperties props = new AppProperties();
        props.getOutput().setGleansPath(target.toString());
        UUID id = UUID.fromString("00000000-0000-0000-0000-000000000001");
        GleanRecord record = new GleanRecord(id, Glean.forVendor(LocalDate.of(2020, 4, 25),
                "v1 generally charges between on 25 day of each month invoices are sent. On 2020-04-25, an invoice from v1 has not been received",
                GleanType.NO_INVOICE_RECEIVED, null, "v1"));

        Optional<Path> written = new CsvGleanExporter(props).export(List.of(record));

        assertThat(written).contains(target);
        List<String> lines = Files.readAllLines(target);
        assertThat(lines).containsExactly(
                "glean_id,glean_date,glean_text,glean_type,glean_location,invoice_id,canonical_vendor_id",
                id + ",2020-04-25,\"v1 generally charges between on 25 day of each month invoices are sent."
                        + " On 2020-04-25, an invoice from v1 has not been received\",no_invoice_received,vendor,,v1");
    }

    @Test
    void blankPathDisablesExport() {
        AppProperties props = new AppProperties();

        assertThat(new CsvGleanExporter(props).export(List.of())).isEmpty();
    }
}
