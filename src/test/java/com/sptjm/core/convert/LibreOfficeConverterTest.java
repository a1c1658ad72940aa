package com.sptjm.core.convert;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class LibreOfficeConverterTest {

    private static final String WRITE_PDF = """
        #!/bin/sh
        out=""
        doc=""
        while [ $# -gt 0 ]; do
          case "$1" in
            --outdir) out="$2"; shift 2 ;;
            *) doc="$1"; shift ;;
          esac
        done
        name=$(basename "$doc")
        printf '%s' "fake pdf" > "$out/${name%.*}.pdf"
        echo "convert $doc -> $out"
        """;

    @TempDir
    Path tempDir;

    private Path document;

    @BeforeEach
    void setUp() throws IOException {
        document = tempDir.resolve("SPTJM_ana_1.docx");
        Files.writeString(document, "docx");
    }

    @Test
    void convertsIntoTargetDirectory() throws Exception {
        Path soffice = script("soffice", WRITE_PDF);
        LibreOfficeConverter converter = new LibreOfficeConverter(soffice, Duration.ofSeconds(20));

        converter.verify();
        Path pdf = converter.convert(document, tempDir.resolve("pdf"));

        assertEquals(tempDir.resolve("pdf").resolve("SPTJM_ana_1.pdf"), pdf);
        assertTrue(Files.size(pdf) > 0);
    }

    @Test
    void nonZeroExitIsReportedWithProcessOutput() throws Exception {
        Path soffice = script("soffice", "#!/bin/sh\necho 'source file could not be loaded' >&2\nexit 3\n");
        LibreOfficeConverter converter = new LibreOfficeConverter(soffice, Duration.ofSeconds(20));

        ConversionFailedException ex = assertThrows(ConversionFailedException.class,
            () -> converter.convert(document, tempDir));

        assertEquals("ConversionFailed", ex.reasonCode());
        assertTrue(ex.getMessage().contains("code 3"), ex.getMessage());
        assertTrue(ex.getMessage().contains("could not be loaded"), ex.getMessage());
    }

    @Test
    void missingOutputIsAFailure() throws Exception {
        Path soffice = script("soffice", "#!/bin/sh\nexit 0\n");
        LibreOfficeConverter converter = new LibreOfficeConverter(soffice, Duration.ofSeconds(20));

        assertThrows(ConversionFailedException.class, () -> converter.convert(document, tempDir.resolve("pdf")));
    }

    @Test
    void hungConverterIsKilledAtTimeout() throws Exception {
        Path soffice = script("soffice", "#!/bin/sh\nsleep 60\n");
        LibreOfficeConverter converter = new LibreOfficeConverter(soffice, Duration.ofSeconds(1));

        long start = System.nanoTime();
        ConversionTimeoutException ex = assertThrows(ConversionTimeoutException.class,
            () -> converter.convert(document, tempDir.resolve("pdf")));
        long elapsedMillis = Duration.ofNanos(System.nanoTime() - start).toMillis();

        assertEquals("ConversionTimeout", ex.reasonCode());
        assertEquals(Duration.ofSeconds(1), ex.getTimeout());
        assertTrue(elapsedMillis < 30_000, "took " + elapsedMillis + " ms");
    }

    @Test
    void configuredPathThatDoesNotExistFailsVerification() {
        LibreOfficeConverter converter = new LibreOfficeConverter(tempDir.resolve("nope/soffice"), Duration.ofSeconds(5));

        ConverterNotFoundException ex = assertThrows(ConverterNotFoundException.class, converter::verify);
        assertEquals("ConverterNotFound", ex.reasonCode());
    }

    @Test
    void outputNameFollowsDocumentStem() {
        assertEquals(tempDir.resolve("a.b.pdf"), LibreOfficeConverter.expectedOutput(Path.of("x/a.b.docx"), tempDir));
        assertEquals(tempDir.resolve("plain.pdf"), LibreOfficeConverter.expectedOutput(Path.of("plain"), tempDir));
    }

    private Path script(String name, String body) throws IOException {
        assumeTrue(!System.getProperty("os.name", "").toLowerCase(Locale.ROOT).contains("win"), "POSIX shell required");
        assumeTrue(Files.isExecutable(Path.of("/bin/sh")), "/bin/sh required");
        Path file = tempDir.resolve("bin").resolve(name);
        Files.createDirectories(file.getParent());
        Files.writeString(file, body, StandardCharsets.UTF_8);
        assumeTrue(file.toFile().setExecutable(true), "cannot mark script executable");
        return file;
    }
}
