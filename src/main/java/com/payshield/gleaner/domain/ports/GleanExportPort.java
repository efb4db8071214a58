package com.payshield.gleaner.domain.ports;

import com.payshield.gleaner.domain.GleanRecord;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

public interface GleanExportPort {

    /**
     * Writes the gleans of one run.
     *
     * @return the written file, or empty when export is not configured
     */
    Optional<Path> export(List<GleanRecord> gleans);
}
