package com.sptjm.core.batch;

import com.sptjm.core.convert.ConversionException;
import com.sptjm.core.convert.ConverterNotFoundException;
import com.sptjm.core.convert.DocumentConverter;
import com.sptjm.core.fs.FileNames;
import com.sptjm.core.model.GenerationOutcome;
import com.sptjm.core.model.LetterRecord;
import com.sptjm.core.render.TemplateRenderer;
import com.sptjm.core.report.GenerationReport;
import com.sptjm.logging.AppLogger;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Drives render and conversion over the selected records, one at a time, and packages the results.
 * <p>
 * A failing record never stops the batch: its exception is caught at the record boundary and reported as a
 * FAILED outcome. Only an unreachable converter, detected before the first record, aborts the run.
 */
public class BatchOrchestrator {
    private static final Logger LOGGER = AppLogger.get();

    public static final String ARCHIVE_NAME = "SPTJM_PDF.zip";
    public static final String SAMPLE_ARCHIVE_NAME = "SPTJM_sample.zip";
    public static final String SAMPLE_PREVIEW_NAME = "SPTJM_sample.pdf";
    public static final String PDF_DIR = "pdf";
    static final String WORK_DIR = "work";
    static final String DUPLICATE_NAME = "DuplicateDocumentName";

    private final TemplateRenderer renderer;
    private final DocumentConverter converter;
    private final BooleanSupplier stopRequested;

    public BatchOrchestrator(TemplateRenderer renderer, DocumentConverter converter, BooleanSupplier stopRequested) {
        this.renderer = renderer;
        this.converter = converter;
        this.stopRequested = stopRequested == null ? () -> false : stopRequested;
    }

    public BatchResult run(BatchRequest request) throws ConverterNotFoundException, IOException {
        converter.verify();

        Path outputDir = request.outputDir();
        Path pdfDir = outputDir.resolve(PDF_DIR);
        Path workDir = outputDir.resolve(WORK_DIR);
        Files.createDirectories(pdfDir);
        Files.createDirectories(workDir);

        List<LetterRecord> selection = request.selection();
        LOGGER.info("Generating %d letters (offset %d of %d records)".formatted(selection.size(), request.offset(), request.records().size()));

        List<GenerationOutcome> outcomes = new ArrayList<>();
        List<Path> documents = new ArrayList<>();
        Map<String, LetterRecord> recordsById = new LinkedHashMap<>();
        Map<String, String> ownerByName = new HashMap<>();
        boolean cancelled = false;
        int index = 0;
        for (LetterRecord record : selection) {
            if (stopRequested.getAsBoolean()) {
                LOGGER.warning("Stop requested; %d of %d letters left unprocessed".formatted(selection.size() - index, selection.size()));
                cancelled = true;
                break;
            }
            index++;
            recordsById.put(record.id(), record);
            LOGGER.info("[%d/%d] Generating %s (NIP %s)".formatted(index, selection.size(), record.name(), record.id()));
            String documentName = FileNames.documentName(record, "pdf");
            String owner = ownerByName.putIfAbsent(documentName, record.id());
            GenerationOutcome outcome;
            if (owner != null) {
                LOGGER.warning("%s (NIP %s) maps to %s, already used by NIP %s".formatted(record.name(), record.id(), documentName, owner));
                outcome = GenerationOutcome.failure(record, "%s: %s already used by NIP %s".formatted(DUPLICATE_NAME, documentName, owner));
            } else {
                outcome = generateOne(record, documentName, workDir, pdfDir, request.keepIntermediates());
            }
            outcomes.add(outcome);
            if (outcome.isSuccess()) {
                documents.add(pdfDir.resolve(outcome.documentName()));
            }
        }

        Path report = outputDir.resolve(GenerationReport.DEFAULT_FILENAME);
        GenerationReport.write(report, outcomes);

        List<Path> sample = documents.subList(0, Math.min(request.sampleCount(), documents.size()));
        List<String> sampleNames = new ArrayList<>();
        for (Path path : sample) {
            sampleNames.add(path.getFileName().toString());
        }
        Path manifest = outputDir.resolve(GenerationManifestWriter.DEFAULT_FILENAME);
        GenerationManifestWriter.write(manifest, outcomes, recordsById, sampleNames, cancelled);

        Path archive = outputDir.resolve(ARCHIVE_NAME);
        ArchiveWriter.write(archive, documents);
        Path sampleArchive = outputDir.resolve(SAMPLE_ARCHIVE_NAME);
        ArchiveWriter.write(sampleArchive, sample);
        Path preview = mergePreview(sample, outputDir.resolve(SAMPLE_PREVIEW_NAME));

        if (!request.keepIntermediates()) {
            deleteIfEmpty(workDir);
        }

        BatchResult result = new BatchResult(outcomes, documents, sample, archive, sampleArchive, preview, report, manifest, cancelled);
        LOGGER.info("Generation finished: %d ok, %d failed%s".formatted(result.succeeded(), result.failed(), cancelled ? " (stopped early)" : ""));
        return result;
    }

    private GenerationOutcome generateOne(LetterRecord record, String documentName, Path workDir, Path pdfDir, boolean keepIntermediate) {
        Path intermediate = workDir.resolve(FileNames.documentName(record, "docx"));
        Path target = pdfDir.resolve(documentName);
        try {
            Files.deleteIfExists(target);
            renderer.render(record, intermediate);
            Path converted = converter.convert(intermediate, pdfDir);
            if (!converted.equals(target)) {
                Files.move(converted, target, StandardCopyOption.REPLACE_EXISTING);
            }
            return GenerationOutcome.success(record, documentName);
        } catch (ConversionException ex) {
            LOGGER.warning("Conversion failed for %s (NIP %s): %s".formatted(record.name(), record.id(), ex.getMessage()));
            return GenerationOutcome.failure(record, ex.reasonCode() + ": " + ex.getMessage());
        } catch (IOException ex) {
            LOGGER.log(Level.WARNING, "Rendering failed for %s (NIP %s)".formatted(record.name(), record.id()), ex);
            return GenerationOutcome.failure(record, "RenderFailed: " + ex.getMessage());
        } catch (RuntimeException ex) {
            LOGGER.log(Level.SEVERE, "Unexpected error for %s (NIP %s)".formatted(record.name(), record.id()), ex);
            return GenerationOutcome.failure(record, ex.getClass().getSimpleName() + ": " + ex.getMessage());
        } finally {
            if (!keepIntermediate) {
                try {
                    Files.deleteIfExists(intermediate);
                } catch (IOException ex) {
                    LOGGER.fine(() -> "Could not delete " + intermediate + ": " + ex.getMessage());
                }
            }
        }
    }

    private static Path mergePreview(List<Path> sample, Path target) {
        if (sample.isEmpty()) {
            return null;
        }
        try {
            SamplePreviewMerger.merge(sample, target);
            return target;
        } catch (IOException ex) {
            LOGGER.log(Level.WARNING, "Could not build the sample preview PDF", ex);
            return null;
        }
    }

    private static void deleteIfEmpty(Path dir) {
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir)) {
            if (!entries.iterator().hasNext()) {
                Files.delete(dir);
            }
        } catch (IOException ex) {
            LOGGER.fine(() -> "Could not remove " + dir + ": " + ex.getMessage());
        }
    }
}
