package com.sptjm.cli;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Parsed command line: {@code <command> <input> [--option value | --flag]...}.
 * Options may also be written {@code --option=value}.
 */
final class CliOptions {
    static final Set<String> VALUE_OPTIONS = Set.of(
        "sheet", "out", "template", "offset", "limit", "sample", "stop-file",
        "mapping", "subject", "body", "delay", "resume"
    );
    static final Set<String> FLAGS = Set.of("keep-intermediate", "live", "confirm");

    private final String command;
    private final List<String> positionals;
    private final Map<String, String> values;
    private final Set<String> flags;

    private CliOptions(String command, List<String> positionals, Map<String, String> values, Set<String> flags) {
        this.command = command;
        this.positionals = positionals;
        this.values = values;
        this.flags = flags;
    }

    static CliOptions parse(String[] args) {
        if (args == null || args.length == 0) {
            throw new IllegalArgumentException("Missing command");
        }
        String command = args[0].trim().toLowerCase(Locale.ROOT);
        List<String> positionals = new ArrayList<>();
        Map<String, String> values = new LinkedHashMap<>();
        Set<String> flags = new LinkedHashSet<>();
        for (int i = 1; i < args.length; i++) {
            String arg = args[i];
            if (!arg.startsWith("--")) {
                positionals.add(arg);
                continue;
            }
            String name = arg.substring(2);
            String inline = null;
            int eq = name.indexOf('=');
            if (eq >= 0) {
                inline = name.substring(eq + 1);
                name = name.substring(0, eq);
            }
            if (FLAGS.contains(name)) {
                if (inline != null) {
                    throw new IllegalArgumentException("--" + name + " takes no value");
                }
                flags.add(name);
            } else if (VALUE_OPTIONS.contains(name)) {
                if (inline == null) {
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("--" + name + " needs a value");
                    }
                    inline = args[++i];
                }
                values.put(name, inline);
            } else {
                throw new IllegalArgumentException("Unknown option --" + name);
            }
        }
        return new CliOptions(command, positionals, values, flags);
    }

    String command() {
        return command;
    }

    Path input() {
        if (positionals.isEmpty()) {
            throw new IllegalArgumentException("Missing input workbook");
        }
        if (positionals.size() > 1) {
            throw new IllegalArgumentException("Unexpected argument: " + positionals.get(1));
        }
        return Path.of(positionals.get(0));
    }

    String string(String name) {
        String value = values.get(name);
        return value == null || value.isBlank() ? null : value;
    }

    Path path(String name) {
        String value = string(name);
        return value == null ? null : Path.of(value);
    }

    Path path(String name, Path fallback) {
        Path value = path(name);
        return value == null ? fallback : value;
    }

    int nonNegativeInt(String name, int fallback) {
        String value = string(name);
        if (value == null) {
            return fallback;
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed < 0) {
                throw new IllegalArgumentException("--" + name + " must not be negative: " + value);
            }
            return parsed;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("--" + name + " expects a whole number: " + value, ex);
        }
    }

    Duration seconds(String name, Duration fallback) {
        String value = string(name);
        if (value == null) {
            return fallback;
        }
        try {
            double seconds = Double.parseDouble(value.trim());
            if (seconds < 0) {
                throw new IllegalArgumentException("--" + name + " must not be negative: " + value);
            }
            return Duration.ofMillis(Math.round(seconds * 1000));
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("--" + name + " expects seconds: " + value, ex);
        }
    }

    /**
     * Message template with {@code \n} escapes turned into line breaks.
     */
    String template(String name) {
        String value = string(name);
        return value == null ? null : value.replace("\\n", "\n");
    }

    boolean flag(String name) {
        return flags.contains(name);
    }
}
