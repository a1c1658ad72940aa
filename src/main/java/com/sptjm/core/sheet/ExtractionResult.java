package com.sptjm.core.sheet;

import com.sptjm.core.model.LetterRecord;

import java.util.List;

/**
 * Records pulled from a sheet plus the bookkeeping for rows that produced none.
 * {@code records().size() + skippedRows() == dataRows()} always holds.
 */
public record ExtractionResult(List<LetterRecord> records, int skippedRows, int dataRows, int proposalSlots) {

    public ExtractionResult {
        records = List.copyOf(records);
    }
}
