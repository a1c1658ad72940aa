package com.sptjm.config;

import com.sptjm.logging.AppLogger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Properties;
import java.util.function.UnaryOperator;
import java.util.logging.Logger;

/**
 * Process-wide configuration for the converter and the mail transport.
 * Every key is resolved from a system property, then the environment, then the
 * classpath {@code sptjm.properties}; the result never changes during a run.
 */
public final class LetterConfig {
    private static final Logger LOGGER = AppLogger.get();

    public static final String PROPERTIES_RESOURCE = "sptjm.properties";

    static final String KEY_SOFFICE_PATH = "SOFFICE_PATH";
    static final String KEY_SOFFICE_TIMEOUT = "SOFFICE_TIMEOUT_SECONDS";
    static final String KEY_SMTP_HOST = "SMTP_HOST";
    static final String KEY_SMTP_PORT = "SMTP_PORT";
    static final String KEY_SMTP_USER = "SMTP_USER";
    static final String KEY_SMTP_PASS = "SMTP_PASS";
    static final String KEY_SMTP_FROM_NAME = "SMTP_FROM_NAME";
    static final String KEY_SMTP_TIMEOUT = "SMTP_TIMEOUT_SECONDS";
    static final String KEY_EMAIL_DELAY = "SPTJM_EMAIL_DELAY_SECONDS";

    static final Duration DEFAULT_CONVERSION_TIMEOUT = Duration.ofSeconds(120);
    static final Duration DEFAULT_SMTP_TIMEOUT = Duration.ofSeconds(30);
    static final Duration DEFAULT_EMAIL_DELAY = Duration.ofMillis(700);

    private final Path sofficePath;
    private final Duration conversionTimeout;
    private final SmtpSettings smtp;
    private final Duration emailDelay;

    public LetterConfig(Path sofficePath, Duration conversionTimeout, SmtpSettings smtp, Duration emailDelay) {
        this.sofficePath = sofficePath;
        this.conversionTimeout = conversionTimeout;
        this.smtp = smtp;
        this.emailDelay = emailDelay;
    }

    public static LetterConfig load() {
        Properties fileProps = loadFileProperties();
        Map<String, String> env = System.getenv();
        return from(key -> firstNonBlank(System.getProperty(key), env.get(key), fileProps.getProperty(key)));
    }

    static LetterConfig from(UnaryOperator<String> lookup) {
        String soffice = lookup.apply(KEY_SOFFICE_PATH);
        SmtpSettings smtp = new SmtpSettings(
            lookup.apply(KEY_SMTP_HOST),
            parseInt(lookup.apply(KEY_SMTP_PORT), SmtpSettings.DEFAULT_PORT),
            lookup.apply(KEY_SMTP_USER),
            lookup.apply(KEY_SMTP_PASS),
            lookup.apply(KEY_SMTP_FROM_NAME),
            parseTimeout(lookup.apply(KEY_SMTP_TIMEOUT), DEFAULT_SMTP_TIMEOUT)
        );
        return new LetterConfig(
            soffice == null ? null : Path.of(soffice),
            parseTimeout(lookup.apply(KEY_SOFFICE_TIMEOUT), DEFAULT_CONVERSION_TIMEOUT),
            smtp,
            parseSeconds(lookup.apply(KEY_EMAIL_DELAY), DEFAULT_EMAIL_DELAY)
        );
    }

    /**
     * Configured converter executable, or {@code null} to search the usual install locations.
     */
    public Path getSofficePath() {
        return sofficePath;
    }

    public Duration getConversionTimeout() {
        return conversionTimeout;
    }

    public SmtpSettings getSmtp() {
        return smtp;
    }

    public Duration getEmailDelay() {
        return emailDelay;
    }

    private static Properties loadFileProperties() {
        Properties props = new Properties();
        try (InputStream stream = LetterConfig.class.getClassLoader().getResourceAsStream(PROPERTIES_RESOURCE)) {
            if (stream != null) {
                props.load(stream);
            }
        } catch (IOException ex) {
            LOGGER.warning("Could not read " + PROPERTIES_RESOURCE + ": " + ex.getMessage());
        }
        return props;
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }

    private static int parseInt(String raw, int fallback) {
        try {
            return raw == null ? fallback : Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }

    private static Duration parseTimeout(String raw, Duration fallback) {
        Duration parsed = parseSeconds(raw, fallback);
        return parsed.isZero() ? fallback : parsed;
    }

    private static Duration parseSeconds(String raw, Duration fallback) {
        if (raw == null) {
            return fallback;
        }
        try {
            double seconds = Double.parseDouble(raw.trim());
            if (!Double.isFinite(seconds) || seconds < 0) {
                LOGGER.warning("Ignoring invalid duration '%s', using %s".formatted(raw, fallback));
                return fallback;
            }
            return Duration.ofMillis(Math.round(seconds * 1000));
        } catch (NumberFormatException ex) {
            LOGGER.warning("Ignoring invalid duration '%s', using %s".formatted(raw, fallback));
            return fallback;
        }
    }
}
