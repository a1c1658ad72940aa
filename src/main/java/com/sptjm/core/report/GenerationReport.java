package com.sptjm.core.report;

import com.sptjm.core.model.GenerationOutcome;
import com.sptjm.core.model.GenerationStatus;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * {@code SPTJM_generate_report.csv}: one row per processed record, in processing order.
 */
public final class GenerationReport {
    public static final String DEFAULT_FILENAME = "SPTJM_generate_report.csv";
    static final List<String> HEADER = List.of("ID", "name", "status", "reason");

    private GenerationReport() {
    }

    public static void write(Path target, List<GenerationOutcome> outcomes) throws IOException {
        List<List<String>> rows = new ArrayList<>(outcomes.size());
        for (GenerationOutcome outcome : outcomes) {
            rows.add(List.of(outcome.recordId(), outcome.name(), outcome.status().name(), outcome.reason()));
        }
        CsvFormat.write(target, HEADER, rows);
    }

    /**
     * Reads a report back. Document names are not stored, so callers re-derive them from the records.
     */
    public static List<GenerationOutcome> read(Path source) throws IOException {
        List<List<String>> records = CsvFormat.read(source);
        if (records.isEmpty() || !records.get(0).equals(HEADER)) {
            throw new IOException("Not a generation report: " + source);
        }
        List<GenerationOutcome> outcomes = new ArrayList<>();
        for (List<String> row : records.subList(1, records.size())) {
            if (row.size() < HEADER.size()) {
                continue;
            }
            GenerationStatus status;
            try {
                status = GenerationStatus.valueOf(row.get(2).trim());
            } catch (IllegalArgumentException ex) {
                throw new IOException("Unknown status '%s' in %s".formatted(row.get(2), source), ex);
            }
            outcomes.add(new GenerationOutcome(row.get(0), row.get(1), status, null, row.get(3)));
        }
        return outcomes;
    }
}
