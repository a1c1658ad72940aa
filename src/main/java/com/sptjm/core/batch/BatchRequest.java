package com.sptjm.core.batch;

import com.sptjm.core.model.LetterRecord;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * What one generation run works on.
 *
 * @param offset            index of the first record to generate
 * @param limit             how many records to generate from {@code offset}; 0 means all remaining
 * @param sampleCount       how many of the first successes go into the sample set
 * @param keepIntermediates keep the rendered {@code .docx} files next to the PDFs
 */
public record BatchRequest(List<LetterRecord> records,
                           int offset,
                           int limit,
                           int sampleCount,
                           Path outputDir,
                           boolean keepIntermediates) {

    public BatchRequest {
        records = List.copyOf(records);
        Objects.requireNonNull(outputDir, "outputDir");
        if (offset < 0 || limit < 0 || sampleCount < 0) {
            throw new IllegalArgumentException("offset, limit and sample count must not be negative");
        }
    }

    public static BatchRequest all(List<LetterRecord> records, int sampleCount, Path outputDir) {
        return new BatchRequest(records, 0, 0, sampleCount, outputDir, false);
    }

    public List<LetterRecord> selection() {
        int from = Math.min(offset, records.size());
        int to = limit == 0 ? records.size() : (int) Math.min((long) from + limit, records.size());
        return records.subList(from, to);
    }
}
