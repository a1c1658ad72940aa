package com.sptjm.core.batch;

import com.sptjm.core.model.GenerationOutcome;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcomes and artifacts of one generation run.
 *
 * @param documents     generated PDFs in record order
 * @param samplePreview merged sample PDF, {@code null} when there was nothing to merge or merging failed
 * @param cancelled     the stop signal ended the run before every selected record was processed
 */
public record BatchResult(List<GenerationOutcome> outcomes,
                          List<Path> documents,
                          List<Path> sampleDocuments,
                          Path archive,
                          Path sampleArchive,
                          Path samplePreview,
                          Path report,
                          Path manifest,
                          boolean cancelled) {

    public BatchResult {
        outcomes = List.copyOf(outcomes);
        documents = List.copyOf(documents);
        sampleDocuments = List.copyOf(sampleDocuments);
    }

    public long succeeded() {
        return outcomes.stream().filter(GenerationOutcome::isSuccess).count();
    }

    public long failed() {
        return outcomes.size() - succeeded();
    }
}
