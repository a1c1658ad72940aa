package com.sptjm.integration.mail;

import com.sptjm.core.model.DispatchOutcome;
import com.sptjm.core.model.DispatchStatus;
import com.sptjm.core.model.GenerationOutcome;
import com.sptjm.core.model.LetterRecord;
import com.sptjm.core.report.DispatchReport;
import jakarta.mail.MessagingException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DispatchEngineTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-10-05T03:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path pdfDir;

    private final RecordingTransport transport = new RecordingTransport();
    private final List<Duration> sleeps = new ArrayList<>();
    private final Sleeper sleeper = sleeps::add;

    private LetterRecord ana;
    private LetterRecord budi;
    private LetterRecord citra;
    private List<GenerationOutcome> generated;

    @BeforeEach
    void setUp() throws IOException {
        ana = new LetterRecord("1", "Ana", "FT", "1", "", "ana@x.com", List.of());
        budi = new LetterRecord("999", "Budi", "FK", "2", "", null, List.of());
        citra = new LetterRecord("3", "Citra", "FH", "3", "", "citra@x.com", List.of());
        generated = List.of(
            GenerationOutcome.success(ana, "SPTJM_ana_1.pdf"),
            GenerationOutcome.success(budi, "SPTJM_budi_999.pdf"),
            GenerationOutcome.success(citra, "SPTJM_citra_3.pdf")
        );
        for (GenerationOutcome outcome : generated) {
            Files.writeString(pdfDir.resolve(outcome.documentName()), "%PDF");
        }
    }

    @Test
    void dryRunNeverTouchesTheTransport() throws IOException {
        DispatchEngine engine = engine(DispatchSettings.defaults(DispatchMode.DRY_RUN, Duration.ZERO));

        List<DispatchOutcome> outcomes = engine.dispatch(List.of(ana, budi, citra), generated, pdfDir, null);

        assertTrue(transport.sent.isEmpty());
        assertEquals(List.of(DispatchStatus.DRY_RUN, DispatchStatus.SKIP, DispatchStatus.DRY_RUN), statuses(outcomes));
        assertEquals("SPTJM - Ana (1)", outcomes.get(0).detail());
        assertEquals("no email address", outcomes.get(1).detail());
        assertEquals(DispatchState.DONE, engine.state());
    }

    @Test
    void liveDispatchRequiresConfirmation() {
        DispatchEngine engine = engine(DispatchSettings.defaults(DispatchMode.LIVE, Duration.ZERO));

        assertThrows(IllegalStateException.class, () -> engine.dispatch(List.of(ana), generated, pdfDir, null));
        assertTrue(transport.sent.isEmpty());
        assertEquals(DispatchState.ARMED, engine.state());
    }

    @Test
    void liveDispatchSendsComposedMessagesWithAttachment() throws IOException {
        DispatchSettings settings = new DispatchSettings(DispatchMode.LIVE,
            "Surat {nama}", "Halo {nama} dari {fakultas}: {file} {tidak_dikenal}", Duration.ZERO, Set.of());
        DispatchEngine engine = engine(settings);
        engine.confirm();

        Path report = pdfDir.resolve("out").resolve(DispatchReport.DEFAULT_FILENAME);
        List<DispatchOutcome> outcomes = engine.dispatch(List.of(ana, citra), generated, pdfDir, report);

        assertEquals(List.of(DispatchStatus.OK, DispatchStatus.OK), statuses(outcomes));
        assertEquals(2, transport.sent.size());
        OutgoingMail first = transport.sent.get(0);
        assertEquals("ana@x.com", first.to());
        assertEquals("Surat Ana", first.subject());
        assertEquals("Halo Ana dari FT: SPTJM_ana_1.pdf {tidak_dikenal}", first.body());
        assertEquals(pdfDir.resolve("SPTJM_ana_1.pdf"), first.attachment());
        assertEquals(Set.of("1", "3"), DispatchReport.readSentIds(report));
    }

    @Test
    void transportErrorBecomesFailWithoutRetry() throws IOException {
        transport.failFor = "citra@x.com";
        DispatchEngine engine = engine(DispatchSettings.defaults(DispatchMode.LIVE, Duration.ZERO));
        engine.confirm();

        List<DispatchOutcome> outcomes = engine.dispatch(List.of(ana, citra), generated, pdfDir, null);

        assertEquals(List.of(DispatchStatus.OK, DispatchStatus.FAIL), statuses(outcomes));
        assertEquals("MessagingException: 550 mailbox unavailable", outcomes.get(1).detail());
        assertEquals(2, transport.attempts);
    }

    @Test
    void delayOnlyPrecedesAttemptsAfterTheFirst() throws IOException {
        DispatchEngine engine = engine(DispatchSettings.defaults(DispatchMode.LIVE, Duration.ofMillis(700)));
        engine.confirm();

        engine.dispatch(List.of(budi, ana, budi, citra), generated, pdfDir, null);

        assertEquals(List.of(Duration.ofMillis(700)), sleeps);
    }

    @Test
    void missingPdfAndAlreadySentAreSkipped() throws IOException {
        Files.delete(pdfDir.resolve("SPTJM_citra_3.pdf"));
        DispatchSettings settings = new DispatchSettings(DispatchMode.LIVE, null, null, Duration.ZERO, Set.of("1"));
        DispatchEngine engine = engine(settings);
        engine.confirm();

        List<DispatchOutcome> outcomes = engine.dispatch(List.of(ana, citra), generated, pdfDir, null);

        assertEquals(List.of(DispatchStatus.SKIP, DispatchStatus.SKIP), statuses(outcomes));
        assertEquals("already sent", outcomes.get(0).detail());
        assertTrue(outcomes.get(1).detail().startsWith("PDF not found"));
        assertTrue(transport.sent.isEmpty());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void failedGenerationsGetNoDispatchOutcome() throws IOException {
        List<GenerationOutcome> mixed = List.of(
            GenerationOutcome.failure(ana, "ConversionFailed: exit 1"),
            GenerationOutcome.success(citra, "SPTJM_citra_3.pdf")
        );
        DispatchEngine engine = engine(DispatchSettings.defaults(DispatchMode.DRY_RUN, Duration.ZERO));

        List<DispatchOutcome> outcomes = engine.dispatch(List.of(ana, citra), mixed, pdfDir, null);

        assertEquals(1, outcomes.size());
        assertEquals("3", outcomes.get(0).recordId());
    }

    @Test
    void stopSignalEndsDispatchAndKeepsWhatWasDone() throws IOException {
        int[] checks = {0};
        DispatchEngine engine = new DispatchEngine(transport, DispatchSettings.defaults(DispatchMode.LIVE, Duration.ZERO),
            sleeper, () -> ++checks[0] > 1, CLOCK);
        engine.confirm();

        List<DispatchOutcome> outcomes = engine.dispatch(List.of(ana, citra), generated, pdfDir, null);

        assertEquals(1, outcomes.size());
        assertEquals(1, transport.sent.size());
        assertEquals(DispatchState.DONE, engine.state());
    }

    @Test
    void engineRunsOnlyOnce() throws IOException {
        DispatchEngine engine = engine(DispatchSettings.defaults(DispatchMode.DRY_RUN, Duration.ZERO));
        engine.dispatch(List.of(ana), generated, pdfDir, null);

        assertThrows(IllegalStateException.class, () -> engine.dispatch(List.of(ana), generated, pdfDir, null));
        assertThrows(IllegalStateException.class, engine::confirm);
    }

    @Test
    void repeatedResumeFromTheSameReportNeverResends() throws IOException {
        Path report = pdfDir.resolve("out").resolve(DispatchReport.DEFAULT_FILENAME);
        for (int run = 0; run < 3; run++) {
            Set<String> alreadySent = Files.exists(report) ? DispatchReport.readSentIds(report) : Set.of();
            DispatchSettings settings = new DispatchSettings(DispatchMode.LIVE, null, null, Duration.ZERO, alreadySent);
            DispatchEngine engine = engine(settings);
            engine.confirm();

            List<DispatchOutcome> outcomes = engine.dispatch(List.of(ana), generated, pdfDir, report);

            assertEquals(run == 0 ? DispatchStatus.OK : DispatchStatus.SKIP, outcomes.get(0).status());
        }
        assertEquals(1, transport.sent.size());
        assertEquals(Set.of("1"), DispatchReport.readSentIds(report));
    }

    @Test
    void outcomesCarryTheClockTime() throws IOException {
        DispatchEngine engine = engine(DispatchSettings.defaults(DispatchMode.DRY_RUN, Duration.ZERO));

        List<DispatchOutcome> outcomes = engine.dispatch(List.of(ana), generated, pdfDir, null);

        assertEquals(CLOCK.instant(), outcomes.get(0).timestamp());
    }

    private DispatchEngine engine(DispatchSettings settings) {
        return new DispatchEngine(transport, settings, sleeper, null, CLOCK);
    }

    private static List<DispatchStatus> statuses(List<DispatchOutcome> outcomes) {
        return outcomes.stream().map(DispatchOutcome::status).toList();
    }

    private static final class RecordingTransport implements MailTransport {
        private final List<OutgoingMail> sent = new ArrayList<>();
        private String failFor;
        private int attempts;

        @Override
        public void send(OutgoingMail mail) throws MessagingException {
            attempts++;
            if (mail.to().equals(failFor)) {
                throw new MessagingException("550 mailbox unavailable");
            }
            sent.add(mail);
        }
    }
}
