package com.sptjm.cli;

import com.sptjm.config.LetterConfig;
import com.sptjm.core.batch.BatchOrchestrator;
import com.sptjm.core.batch.BatchRequest;
import com.sptjm.core.batch.BatchResult;
import com.sptjm.core.convert.ConverterNotFoundException;
import com.sptjm.core.convert.DocumentConverter;
import com.sptjm.core.convert.LibreOfficeConverter;
import com.sptjm.core.fs.FileNames;
import com.sptjm.core.model.DispatchOutcome;
import com.sptjm.core.model.GenerationOutcome;
import com.sptjm.core.model.LetterRecord;
import com.sptjm.core.render.TemplateRenderer;
import com.sptjm.core.report.CsvFormat;
import com.sptjm.core.report.DispatchReport;
import com.sptjm.core.report.GenerationReport;
import com.sptjm.core.sheet.EmailMapping;
import com.sptjm.core.sheet.EmailReconciler;
import com.sptjm.core.sheet.ExtractionResult;
import com.sptjm.core.sheet.RecordExtractor;
import com.sptjm.core.sheet.SchemaException;
import com.sptjm.core.sheet.SheetTable;
import com.sptjm.core.sheet.WorkbookTableReader;
import com.sptjm.integration.mail.DispatchEngine;
import com.sptjm.integration.mail.DispatchMode;
import com.sptjm.integration.mail.DispatchSettings;
import com.sptjm.integration.mail.MailTransport;
import com.sptjm.integration.mail.Sleeper;
import com.sptjm.integration.mail.SmtpMailTransport;
import com.sptjm.logging.AppLogger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.BooleanSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command line entry point.
 * <pre>
 * generate &lt;sheet.xlsx&gt; [--sheet NAME] [--out DIR] [--template FILE] [--offset N] [--limit N]
 *          [--sample K] [--keep-intermediate] [--stop-file FILE]
 * dispatch &lt;sheet.xlsx&gt; --out DIR [--sheet NAME] [--mapping FILE] [--subject S] [--body B]
 *          [--delay SECONDS] [--resume REPORT.csv] [--live --confirm] [--stop-file FILE]
 * run      &lt;sheet.xlsx&gt; generate options plus dispatch options
 * </pre>
 */
public final class LetterBatchCli {
    private static final Logger LOGGER = AppLogger.get();

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    static final Path DEFAULT_OUT = Path.of("sptjm-output");
    static final int DEFAULT_SAMPLE = 5;

    private LetterBatchCli() {
    }

    public static void main(String[] args) {
        int code = run(args, LetterConfig.load(), null);
        if (code != EXIT_OK) {
            System.exit(code);
        }
    }

    /**
     * @param transportOverride transport used for live dispatch instead of SMTP, {@code null} in production
     */
    static int run(String[] args, LetterConfig config, MailTransport transportOverride) {
        CliOptions options;
        try {
            options = CliOptions.parse(args);
        } catch (IllegalArgumentException ex) {
            System.err.println(ex.getMessage());
            printUsage();
            return EXIT_USAGE;
        }
        try {
            switch (options.command()) {
                case "generate" -> generate(options, config);
                case "dispatch" -> dispatch(options, config, transportOverride);
                case "run" -> {
                    BatchResult result = generate(options, config);
                    if (result != null && !result.cancelled()) {
                        dispatch(options, config, transportOverride, loadRecords(options), result.outcomes());
                    }
                }
                default -> {
                    System.err.println("Unknown command: " + options.command());
                    printUsage();
                    return EXIT_USAGE;
                }
            }
            return EXIT_OK;
        } catch (IllegalArgumentException ex) {
            System.err.println(ex.getMessage());
            return EXIT_USAGE;
        } catch (SchemaException ex) {
            LOGGER.severe("Input sheet rejected: " + ex.getMessage());
            return EXIT_FAILURE;
        } catch (ConverterNotFoundException ex) {
            LOGGER.severe(ex.getMessage());
            return EXIT_FAILURE;
        } catch (IOException ex) {
            LOGGER.log(Level.SEVERE, "Run failed: " + ex.getMessage(), ex);
            return EXIT_FAILURE;
        }
    }

    private static BatchResult generate(CliOptions options, LetterConfig config)
        throws IOException, SchemaException, ConverterNotFoundException {
        List<LetterRecord> records = loadRecords(options);
        if (records.isEmpty()) {
            LOGGER.warning("No usable records in " + options.input());
            return null;
        }
        Path template = options.path("template");
        if (template != null && !Files.isRegularFile(template)) {
            throw new IllegalArgumentException("Template not found: " + template);
        }
        BatchRequest request = new BatchRequest(
            records,
            options.nonNegativeInt("offset", 0),
            options.nonNegativeInt("limit", 0),
            options.nonNegativeInt("sample", DEFAULT_SAMPLE),
            options.path("out", DEFAULT_OUT),
            options.flag("keep-intermediate")
        );
        DocumentConverter converter = new LibreOfficeConverter(config.getSofficePath(), config.getConversionTimeout());
        TemplateRenderer renderer = new TemplateRenderer(template, LocalDate.now());
        BatchOrchestrator orchestrator = new BatchOrchestrator(renderer, converter, stopSignal(options));
        BatchResult result = orchestrator.run(request);
        LOGGER.info("Archive: " + result.archive().toAbsolutePath());
        return result;
    }

    private static void dispatch(CliOptions options, LetterConfig config, MailTransport transportOverride)
        throws IOException, SchemaException {
        Path reportFile = options.path("out", DEFAULT_OUT).resolve(GenerationReport.DEFAULT_FILENAME);
        if (!Files.isRegularFile(reportFile)) {
            throw new IllegalArgumentException("No generation report at " + reportFile + "; run generate first");
        }
        List<LetterRecord> records = loadRecords(options);
        List<GenerationOutcome> generated = withDocumentNames(GenerationReport.read(reportFile), records);
        dispatch(options, config, transportOverride, records, generated);
    }

    private static void dispatch(CliOptions options,
                                 LetterConfig config,
                                 MailTransport transportOverride,
                                 List<LetterRecord> records,
                                 List<GenerationOutcome> generated) throws IOException, SchemaException {
        boolean live = options.flag("live");
        if (live && !options.flag("confirm")) {
            throw new IllegalArgumentException("Live dispatch sends real email; add --confirm to proceed");
        }
        MailTransport transport = transportOverride;
        if (live && transport == null) {
            if (!config.getSmtp().isComplete()) {
                throw new IllegalArgumentException("Live dispatch needs SMTP_HOST, SMTP_USER and SMTP_PASS");
            }
            transport = new SmtpMailTransport(config.getSmtp());
        }

        Path mappingFile = options.path("mapping");
        if (mappingFile != null) {
            EmailMapping mapping = EmailMapping.read(readMapping(mappingFile));
            records = new EmailReconciler().reconcile(records, mapping);
        }

        Set<String> alreadySent = Set.of();
        Path resume = options.path("resume");
        if (resume != null) {
            alreadySent = DispatchReport.readSentIds(resume);
            LOGGER.info("Resuming: %d letters already sent".formatted(alreadySent.size()));
        }

        DispatchSettings settings = new DispatchSettings(
            live ? DispatchMode.LIVE : DispatchMode.DRY_RUN,
            options.template("subject"),
            options.template("body"),
            options.seconds("delay", config.getEmailDelay()),
            alreadySent
        );
        Path outDir = options.path("out", DEFAULT_OUT);
        DispatchEngine engine = new DispatchEngine(transport, settings, Sleeper.SYSTEM, stopSignal(options));
        if (live) {
            engine.confirm();
        }
        List<DispatchOutcome> outcomes = engine.dispatch(
            records,
            generated,
            outDir.resolve(BatchOrchestrator.PDF_DIR),
            outDir.resolve(DispatchReport.DEFAULT_FILENAME)
        );
        LOGGER.info("Email report: %s (%d rows)".formatted(outDir.resolve(DispatchReport.DEFAULT_FILENAME).toAbsolutePath(), outcomes.size()));
    }

    private static List<LetterRecord> loadRecords(CliOptions options) throws IOException, SchemaException {
        Path input = options.input();
        if (!Files.isRegularFile(input)) {
            throw new IllegalArgumentException("Input workbook not found: " + input);
        }
        WorkbookTableReader reader = new WorkbookTableReader();
        String sheet = options.string("sheet");
        if (sheet != null) {
            List<String> available = reader.sheetNames(input);
            if (!available.contains(sheet)) {
                throw new IllegalArgumentException("Sheet '%s' not found; available: %s".formatted(sheet, available));
            }
        }
        SheetTable table = reader.read(input, sheet);
        ExtractionResult extraction = new RecordExtractor().extract(table);
        return extraction.records();
    }

    private static SheetTable readMapping(Path file) throws IOException, SchemaException {
        if (!Files.isRegularFile(file)) {
            throw new IllegalArgumentException("Mapping file not found: " + file);
        }
        if (file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".csv")) {
            List<List<String>> rows = CsvFormat.read(file);
            if (rows.isEmpty()) {
                throw new SchemaException("Mapping file is empty: " + file);
            }
            return SheetTable.ofText(rows.get(0), rows.subList(1, rows.size()));
        }
        return new WorkbookTableReader().read(file, null);
    }

    /**
     * The generation report does not store file names; they are re-derived from the records.
     */
    static List<GenerationOutcome> withDocumentNames(List<GenerationOutcome> outcomes, List<LetterRecord> records) {
        Map<String, LetterRecord> byId = new HashMap<>();
        for (LetterRecord record : records) {
            byId.putIfAbsent(record.id(), record);
        }
        List<GenerationOutcome> named = new ArrayList<>(outcomes.size());
        for (GenerationOutcome outcome : outcomes) {
            LetterRecord record = byId.get(outcome.recordId());
            if (outcome.isSuccess() && record != null) {
                named.add(GenerationOutcome.success(record, FileNames.documentName(record, "pdf")));
            } else {
                named.add(outcome);
            }
        }
        return named;
    }

    private static BooleanSupplier stopSignal(CliOptions options) throws IOException {
        Path stopFile = options.path("stop-file");
        if (stopFile != null && Files.deleteIfExists(stopFile)) {
            LOGGER.info("Removed stale stop file " + stopFile);
        }
        return new StopFileSignal(stopFile);
    }

    private static void printUsage() {
        System.err.println("""
            Usage:
              generate <sheet.xlsx> [--sheet NAME] [--out DIR] [--template FILE] [--offset N] [--limit N]
                       [--sample K] [--keep-intermediate] [--stop-file FILE]
              dispatch <sheet.xlsx> --out DIR [--sheet NAME] [--mapping FILE] [--subject S] [--body B]
                       [--delay SECONDS] [--resume REPORT.csv] [--live --confirm] [--stop-file FILE]
              run      <sheet.xlsx> options of generate and dispatch""");
    }
}
