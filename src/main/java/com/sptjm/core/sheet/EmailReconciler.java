package com.sptjm.core.sheet;

import com.sptjm.core.model.LetterRecord;
import com.sptjm.logging.AppLogger;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Fills missing addresses from an {@link EmailMapping}. Addresses already present on a record win.
 */
public final class EmailReconciler {
    private static final Logger LOGGER = AppLogger.get();

    public List<LetterRecord> reconcile(List<LetterRecord> records, EmailMapping mapping) {
        List<LetterRecord> result = new ArrayList<>(records.size());
        int filled = 0;
        int missing = 0;
        for (LetterRecord record : records) {
            if (record.hasEmail()) {
                result.add(record);
                continue;
            }
            Optional<String> mapped = mapping.lookup(record.id());
            if (mapped.isPresent()) {
                result.add(record.withEmail(mapped.get()));
                filled++;
            } else {
                result.add(record);
                missing++;
            }
        }
        int filledCount = filled;
        int missingCount = missing;
        LOGGER.info(() -> "Email reconciliation: %d filled from mapping, %d still without address".formatted(filledCount, missingCount));
        return result;
    }
}
