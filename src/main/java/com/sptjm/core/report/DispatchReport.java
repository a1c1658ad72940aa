package com.sptjm.core.report;

import com.sptjm.core.model.DispatchOutcome;
import com.sptjm.core.model.DispatchStatus;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * {@code SPTJM_email_report.csv}: one row per dispatch outcome, in record order.
 */
public final class DispatchReport {
    public static final String DEFAULT_FILENAME = "SPTJM_email_report.csv";
    public static final String ALREADY_SENT = "already sent";
    static final List<String> HEADER = List.of("ID", "name", "address", "status", "timestamp", "detail");
    private static final DateTimeFormatter TIMESTAMP_FORMAT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneId.systemDefault());

    private DispatchReport() {
    }

    public static void write(Path target, List<DispatchOutcome> outcomes) throws IOException {
        List<List<String>> rows = new ArrayList<>(outcomes.size());
        for (DispatchOutcome outcome : outcomes) {
            rows.add(List.of(
                outcome.recordId(),
                outcome.name(),
                outcome.address(),
                outcome.status().label(),
                formatTimestamp(outcome.timestamp()),
                outcome.detail()
            ));
        }
        CsvFormat.write(target, HEADER, rows);
    }

    /**
     * IDs an earlier run already delivered: {@code OK} rows, plus {@code SKIP} rows an earlier resume carried
     * forward as {@value #ALREADY_SENT}. A resumed run skips them.
     */
    public static Set<String> readSentIds(Path source) throws IOException {
        List<List<String>> records = CsvFormat.read(source);
        if (records.isEmpty() || !records.get(0).equals(HEADER)) {
            throw new IOException("Not a dispatch report: " + source);
        }
        Set<String> sent = new LinkedHashSet<>();
        for (List<String> row : records.subList(1, records.size())) {
            if (row.size() < HEADER.size()) {
                continue;
            }
            DispatchStatus status;
            try {
                status = DispatchStatus.fromLabel(row.get(3));
            } catch (IllegalArgumentException ex) {
                throw new IOException("Unknown status '%s' in %s".formatted(row.get(3), source), ex);
            }
            boolean carried = status == DispatchStatus.SKIP && ALREADY_SENT.equals(row.get(5).trim());
            if (status == DispatchStatus.OK || carried) {
                sent.add(row.get(0).trim());
            }
        }
        return sent;
    }

    static String formatTimestamp(Instant timestamp) {
        return timestamp == null ? "" : TIMESTAMP_FORMAT.format(timestamp);
    }
}
