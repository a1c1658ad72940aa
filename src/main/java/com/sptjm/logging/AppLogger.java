package com.sptjm.logging;

import java.io.IOException;
import java.util.logging.FileHandler;
import java.util.logging.Formatter;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.StreamHandler;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Provides the shared logger for the letter batch.
 */
public final class AppLogger {
    private static final String LOG_FILE_PROPERTY = "sptjm.logFile";
    private static final String LOG_FILE_ENV = "SPTJM_LOG_FILE";

    private static final Logger LOGGER = createLogger();

    private AppLogger() {
    }

    public static Logger get() {
        return LOGGER;
    }

    private static Logger createLogger() {
        Logger logger = Logger.getLogger("com.sptjm.LetterBatch");
        logger.setUseParentHandlers(false);
        Formatter formatter = new Formatter() {
            @Override
            public String format(LogRecord record) {
                String line = "%s %s%n".formatted(record.getLevel().getName(), formatMessage(record));
                if (record.getThrown() != null) {
                    line += "  caused by " + record.getThrown() + System.lineSeparator();
                }
                return line;
            }
        };

        StreamHandler consoleHandler = new StreamHandler(System.out, formatter) {
            @Override
            public synchronized void publish(LogRecord record) {
                super.publish(record);
                flush();
            }
        };
        try {
            consoleHandler.setEncoding(UTF_8.name());
        } catch (Exception ignored) {
            // fall back to platform default when UTF-8 is unavailable
        }
        consoleHandler.setLevel(Level.INFO);
        logger.addHandler(consoleHandler);
        logger.setLevel(Level.ALL);

        String logFile = firstNonBlank(System.getProperty(LOG_FILE_PROPERTY), System.getenv(LOG_FILE_ENV));
        if (logFile != null) {
            try {
                FileHandler fileHandler = new FileHandler(logFile, true);
                fileHandler.setEncoding(UTF_8.name());
                fileHandler.setFormatter(formatter);
                fileHandler.setLevel(Level.ALL);
                logger.addHandler(fileHandler);
            } catch (IOException | SecurityException ex) {
                logger.warning("File logging disabled: " + ex.getMessage());
            }
        }
        return logger;
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }
}
