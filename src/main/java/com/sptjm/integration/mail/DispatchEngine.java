package com.sptjm.integration.mail;

import com.sptjm.core.model.DispatchOutcome;
import com.sptjm.core.model.DispatchStatus;
import com.sptjm.core.model.GenerationOutcome;
import com.sptjm.core.model.LetterRecord;
import com.sptjm.core.render.Placeholders;
import com.sptjm.core.report.DispatchReport;
import com.sptjm.logging.AppLogger;
import jakarta.mail.MessagingException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BooleanSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Emails each successfully generated letter to its owner, one at a time.
 * <p>
 * An engine is single use and starts {@link DispatchState#ARMED}. A {@link DispatchMode#LIVE} run must be
 * {@link #confirm() confirmed} first; a dry run composes every message but never touches the transport.
 */
public class DispatchEngine {
    private static final Logger LOGGER = AppLogger.get();

    private final MailTransport transport;
    private final DispatchSettings settings;
    private final Sleeper sleeper;
    private final BooleanSupplier stopRequested;
    private final Clock clock;

    private DispatchState state = DispatchState.ARMED;

    public DispatchEngine(MailTransport transport, DispatchSettings settings, Sleeper sleeper, BooleanSupplier stopRequested) {
        this(transport, settings, sleeper, stopRequested, Clock.systemUTC());
    }

    DispatchEngine(MailTransport transport, DispatchSettings settings, Sleeper sleeper, BooleanSupplier stopRequested, Clock clock) {
        this.transport = transport;
        this.settings = settings;
        this.sleeper = sleeper == null ? Sleeper.SYSTEM : sleeper;
        this.stopRequested = stopRequested == null ? () -> false : stopRequested;
        this.clock = clock;
    }

    public synchronized DispatchState state() {
        return state;
    }

    public synchronized void confirm() {
        if (state != DispatchState.ARMED) {
            throw new IllegalStateException("Dispatch can only be confirmed once, before it starts (state " + state + ")");
        }
        state = DispatchState.CONFIRMED;
    }

    /**
     * Runs the dispatch and, when {@code reportPath} is given, writes the email report there.
     *
     * @param pdfDir directory holding the generated PDFs named by {@link GenerationOutcome#documentName()}
     */
    public List<DispatchOutcome> dispatch(List<LetterRecord> records,
                                          List<GenerationOutcome> generated,
                                          Path pdfDir,
                                          Path reportPath) throws IOException {
        start();
        Map<String, GenerationOutcome> successes = new HashMap<>();
        for (GenerationOutcome outcome : generated) {
            if (outcome.isSuccess()) {
                successes.put(outcome.recordId(), outcome);
            }
        }

        List<DispatchOutcome> outcomes = new ArrayList<>();
        boolean attempted = false;
        try {
            for (LetterRecord record : records) {
                GenerationOutcome generation = successes.get(record.id());
                if (generation == null) {
                    continue;
                }
                if (stopRequested.getAsBoolean()) {
                    LOGGER.warning("Stop requested; dispatch ended after %d messages".formatted(outcomes.size()));
                    break;
                }
                Optional<DispatchOutcome> skip = skipReason(record, generation, pdfDir);
                if (skip.isPresent()) {
                    LOGGER.info("SKIP %s (NIP %s): %s".formatted(record.name(), record.id(), skip.get().detail()));
                    outcomes.add(skip.get());
                    continue;
                }
                if (attempted && !settings.delay().isZero()) {
                    sleeper.sleep(settings.delay());
                }
                attempted = true;
                outcomes.add(attempt(record, pdfDir.resolve(generation.documentName())));
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            LOGGER.warning("Dispatch interrupted after %d messages".formatted(outcomes.size()));
        } finally {
            finish();
        }

        if (reportPath != null) {
            DispatchReport.write(reportPath, outcomes);
        }
        logSummary(outcomes);
        return outcomes;
    }

    private synchronized void start() {
        if (state == DispatchState.DISPATCHING || state == DispatchState.DONE) {
            throw new IllegalStateException("Dispatch already ran (state " + state + ")");
        }
        if (settings.mode() == DispatchMode.LIVE && state != DispatchState.CONFIRMED) {
            throw new IllegalStateException("Live dispatch not confirmed");
        }
        state = DispatchState.DISPATCHING;
    }

    private synchronized void finish() {
        state = DispatchState.DONE;
    }

    private Optional<DispatchOutcome> skipReason(LetterRecord record, GenerationOutcome generation, Path pdfDir) {
        String address = record.emailAddress().orElse("");
        if (settings.alreadySentIds().contains(record.id())) {
            return Optional.of(outcome(record, address, DispatchStatus.SKIP, DispatchReport.ALREADY_SENT));
        }
        if (address.isEmpty()) {
            return Optional.of(outcome(record, address, DispatchStatus.SKIP, "no email address"));
        }
        String documentName = generation.documentName();
        if (documentName == null || !Files.isRegularFile(pdfDir.resolve(documentName))) {
            return Optional.of(outcome(record, address, DispatchStatus.SKIP, "PDF not found: " + documentName));
        }
        return Optional.empty();
    }

    private DispatchOutcome attempt(LetterRecord record, Path pdf) {
        String address = record.emailAddress().orElseThrow();
        Map<String, String> values = messageValues(record, pdf.getFileName().toString());
        OutgoingMail mail = new OutgoingMail(
            address,
            Placeholders.substitute(settings.subjectTemplate(), Placeholders.MESSAGE, values),
            Placeholders.substitute(settings.bodyTemplate(), Placeholders.MESSAGE, values),
            pdf
        );
        if (settings.mode() == DispatchMode.DRY_RUN) {
            LOGGER.info("DRY-RUN %s -> %s: %s".formatted(mail.attachmentName(), address, mail.subject()));
            return outcome(record, address, DispatchStatus.DRY_RUN, mail.subject());
        }
        try {
            transport.send(mail);
            LOGGER.info("OK %s -> %s".formatted(mail.attachmentName(), address));
            return outcome(record, address, DispatchStatus.OK, "");
        } catch (MessagingException | RuntimeException ex) {
            LOGGER.log(Level.WARNING, "FAIL %s -> %s".formatted(mail.attachmentName(), address), ex);
            return outcome(record, address, DispatchStatus.FAIL, ex.getClass().getSimpleName() + ": " + ex.getMessage());
        }
    }

    static Map<String, String> messageValues(LetterRecord record, String fileName) {
        Map<String, String> values = new LinkedHashMap<>();
        values.put("nama", record.name());
        values.put("nip", record.id());
        values.put("fakultas", record.unit());
        values.put("email", record.emailAddress().orElse(""));
        values.put("file", fileName);
        return values;
    }

    private DispatchOutcome outcome(LetterRecord record, String address, DispatchStatus status, String detail) {
        return new DispatchOutcome(record.id(), record.name(), address, status, clock.instant(), detail);
    }

    private static void logSummary(List<DispatchOutcome> outcomes) {
        Map<DispatchStatus, Integer> counts = new LinkedHashMap<>();
        for (DispatchStatus status : DispatchStatus.values()) {
            counts.put(status, 0);
        }
        for (DispatchOutcome outcome : outcomes) {
            counts.merge(outcome.status(), 1, Integer::sum);
        }
        StringBuilder summary = new StringBuilder("Dispatch finished:");
        counts.forEach((status, count) -> summary.append(' ').append(status.label()).append('=').append(count));
        LOGGER.info(summary.toString());
    }
}
