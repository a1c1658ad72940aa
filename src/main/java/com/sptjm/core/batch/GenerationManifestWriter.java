package com.sptjm.core.batch;

import com.sptjm.core.model.GenerationOutcome;
import com.sptjm.core.model.LetterRecord;
import org.json.JSONArray;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Writes {@code SPTJM_manifest.json}, the machine readable companion of the generation report.
 */
public final class GenerationManifestWriter {
    public static final String DEFAULT_FILENAME = "SPTJM_manifest.json";

    private GenerationManifestWriter() {
    }

    public static void write(Path target,
                             List<GenerationOutcome> outcomes,
                             Map<String, LetterRecord> recordsById,
                             List<String> sampleDocuments,
                             boolean cancelled) throws IOException {
        JSONObject root = new JSONObject();
        root.put("generatedAt", Instant.now().toString());
        root.put("cancelled", cancelled);

        long succeeded = outcomes.stream().filter(GenerationOutcome::isSuccess).count();
        JSONObject totals = new JSONObject();
        totals.put("processed", outcomes.size());
        totals.put("succeeded", succeeded);
        totals.put("failed", outcomes.size() - succeeded);
        root.put("totals", totals);

        JSONArray letters = new JSONArray();
        for (GenerationOutcome outcome : outcomes) {
            JSONObject letter = new JSONObject();
            letter.put("id", outcome.recordId());
            letter.put("name", outcome.name());
            letter.put("status", outcome.status().name());
            if (outcome.isSuccess()) {
                letter.put("document", outcome.documentName());
            } else {
                letter.put("reason", outcome.reason());
            }
            LetterRecord record = recordsById.get(outcome.recordId());
            letter.put("proposals", record == null ? 0 : record.proposals().size());
            letters.put(letter);
        }
        root.put("letters", letters);
        root.put("sample", new JSONArray(sampleDocuments));

        Path parent = target.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(
            target,
            root.toString(2),
            StandardOpenOption.CREATE,
            StandardOpenOption.TRUNCATE_EXISTING,
            StandardOpenOption.WRITE
        );
    }
}
