package com.sptjm.cli;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CliOptionsTest {

    @Test
    void parsesValuesFlagsAndInlineValues() {
        CliOptions options = CliOptions.parse(new String[]{
            "Generate", "data.xlsx", "--sheet", "SPTJM 2024", "--limit=10", "--keep-intermediate", "--delay", "1.5"
        });

        assertEquals("generate", options.command());
        assertEquals(Path.of("data.xlsx"), options.input());
        assertEquals("SPTJM 2024", options.string("sheet"));
        assertEquals(10, options.nonNegativeInt("limit", 0));
        assertEquals(0, options.nonNegativeInt("offset", 0));
        assertEquals(Duration.ofMillis(1500), options.seconds("delay", Duration.ZERO));
        assertTrue(options.flag("keep-intermediate"));
        assertFalse(options.flag("live"));
        assertNull(options.path("template"));
        assertEquals(Path.of("fallback"), options.path("out", Path.of("fallback")));
    }

    @Test
    void bodyEscapesBecomeLineBreaks() {
        CliOptions options = CliOptions.parse(new String[]{"dispatch", "x.xlsx", "--body", "Yth. {nama},\\n\\nTerima kasih."});

        assertEquals("Yth. {nama},\n\nTerima kasih.", options.template("body"));
    }

    @Test
    void rejectsUnknownOrIncompleteOptions() {
        assertThrows(IllegalArgumentException.class, () -> CliOptions.parse(new String[]{}));
        assertThrows(IllegalArgumentException.class, () -> CliOptions.parse(new String[]{"generate", "x.xlsx", "--colour", "red"}));
        assertThrows(IllegalArgumentException.class, () -> CliOptions.parse(new String[]{"generate", "x.xlsx", "--out"}));
        assertThrows(IllegalArgumentException.class, () -> CliOptions.parse(new String[]{"generate", "x.xlsx", "--live=yes"}));
    }

    @Test
    void badNumbersAreUsageErrors() {
        CliOptions options = CliOptions.parse(new String[]{"generate", "x.xlsx", "--limit", "-1", "--sample", "lots", "--delay", "-2"});

        assertThrows(IllegalArgumentException.class, () -> options.nonNegativeInt("limit", 0));
        assertThrows(IllegalArgumentException.class, () -> options.nonNegativeInt("sample", 3));
        assertThrows(IllegalArgumentException.class, () -> options.seconds("delay", Duration.ZERO));
    }

    @Test
    void inputIsRequiredAndSingle() {
        assertThrows(IllegalArgumentException.class, () -> CliOptions.parse(new String[]{"generate"}).input());
        assertThrows(IllegalArgumentException.class, () -> CliOptions.parse(new String[]{"generate", "a.xlsx", "b.xlsx"}).input());
    }
}
