package com.sptjm.core.convert;

import com.sptjm.logging.AppLogger;
import com.sptjm.logging.ProcessOutputPump;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * Bridges to a local LibreOffice installation running headless to export letters as PDF.
 * Each call gets its own throwaway user profile so a stale or concurrently used profile cannot block the export.
 */
public final class LibreOfficeConverter implements DocumentConverter {
    private static final Logger LOGGER = AppLogger.get();

    private static final List<String> EXECUTABLE_NAMES = List.of("soffice.exe", "soffice.com", "soffice");
    private static final List<String> WINDOWS_CANDIDATES = List.of(
        "C:\\Program Files\\LibreOffice\\program\\soffice.exe",
        "C:\\Program Files\\LibreOffice\\program\\soffice.com",
        "C:\\Program Files (x86)\\LibreOffice\\program\\soffice.exe",
        "C:\\Program Files (x86)\\LibreOffice\\program\\soffice.com"
    );
    private static final long KILL_GRACE_MILLIS = 5_000;

    private final Path configuredPath;
    private final Duration timeout;

    /**
     * @param configuredPath explicit {@code soffice} location, or {@code null} to search {@code PATH} and the usual install folders
     */
    public LibreOfficeConverter(Path configuredPath, Duration timeout) {
        this.configuredPath = configuredPath;
        this.timeout = timeout;
    }

    @Override
    public void verify() throws ConverterNotFoundException {
        Path executable = resolveExecutable();
        LOGGER.info(() -> "Using LibreOffice at " + executable);
    }

    @Override
    public Path convert(Path document, Path targetDir) throws ConversionException {
        Path executable = resolveExecutable();
        Path profile = null;
        try {
            Files.createDirectories(targetDir);
            profile = Files.createTempDirectory("sptjm_lo_");
            List<String> command = List.of(
                executable.toString(),
                "--headless",
                "--nologo",
                "--nofirststartwizard",
                "-env:UserInstallation=" + profile.toUri(),
                "--convert-to",
                "pdf:writer_pdf_Export",
                "--outdir",
                targetDir.toAbsolutePath().toString(),
                document.toAbsolutePath().toString()
            );
            return run(command, expectedOutput(document, targetDir));
        } catch (ConversionException ex) {
            throw ex;
        } catch (IOException ex) {
            throw new ConversionFailedException("Could not prepare conversion of " + document.getFileName() + ": " + ex.getMessage(), ex);
        } finally {
            deleteQuietly(profile);
        }
    }

    private Path run(List<String> command, Path output) throws ConversionException {
        Process process;
        try {
            process = new ProcessBuilder(command).start();
        } catch (IOException ex) {
            throw new ConverterNotFoundException("Could not start LibreOffice at " + command.get(0) + ": " + ex.getMessage(), ex);
        }
        ProcessOutputPump stdout = ProcessOutputPump.start(process.getInputStream(), LOGGER, Level.FINE, "soffice");
        ProcessOutputPump stderr = ProcessOutputPump.start(process.getErrorStream(), LOGGER, Level.FINE, "soffice-err");
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                terminate(process);
                throw new ConversionTimeoutException(timeout);
            }
            stdout.await(KILL_GRACE_MILLIS);
            stderr.await(KILL_GRACE_MILLIS);
            int exitCode = process.exitValue();
            if (exitCode != 0) {
                throw new ConversionFailedException("LibreOffice exited with code %d%s".formatted(exitCode, describeOutput(stdout, stderr)));
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            terminate(process);
            throw new ConversionFailedException("Conversion interrupted", ex);
        }

        try {
            if (!Files.isRegularFile(output) || Files.size(output) == 0) {
                throw new ConversionFailedException("LibreOffice finished but produced no PDF at %s%s".formatted(output.getFileName(), describeOutput(stdout, stderr)));
            }
        } catch (IOException ex) {
            throw new ConversionFailedException("Could not inspect converted PDF " + output.getFileName(), ex);
        }
        return output;
    }

    Path resolveExecutable() throws ConverterNotFoundException {
        if (configuredPath != null) {
            if (Files.isRegularFile(configuredPath) && Files.isExecutable(configuredPath)) {
                return preferExe(configuredPath);
            }
            throw new ConverterNotFoundException("Configured soffice path not found or not executable: " + configuredPath);
        }
        String pathEnv = System.getenv("PATH");
        if (pathEnv != null) {
            for (String dir : pathEnv.split(File.pathSeparator)) {
                if (dir.isBlank()) {
                    continue;
                }
                for (String name : EXECUTABLE_NAMES) {
                    Path candidate = Paths.get(dir.trim(), name);
                    if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
                        return preferExe(candidate);
                    }
                }
            }
        }
        for (String candidate : WINDOWS_CANDIDATES) {
            Path path = Paths.get(candidate);
            if (Files.isRegularFile(path)) {
                return preferExe(path);
            }
        }
        throw new ConverterNotFoundException("LibreOffice not found; set SOFFICE_PATH to the soffice executable");
    }

    /**
     * The {@code .com} console launcher is less reliable headless than its {@code .exe} sibling.
     */
    private static Path preferExe(Path executable) {
        String name = executable.getFileName().toString();
        if (name.toLowerCase(Locale.ROOT).endsWith(".com")) {
            Path exe = executable.resolveSibling(name.substring(0, name.length() - 4) + ".exe");
            if (Files.isRegularFile(exe)) {
                return exe;
            }
        }
        return executable;
    }

    static Path expectedOutput(Path document, Path targetDir) {
        String name = document.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        return targetDir.resolve(stem + ".pdf");
    }

    private static void terminate(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        try {
            process.waitFor(KILL_GRACE_MILLIS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }

    private static String describeOutput(ProcessOutputPump stdout, ProcessOutputPump stderr) {
        List<String> parts = new ArrayList<>();
        if (!stdout.tail().isBlank()) {
            parts.add("stdout: " + stdout.tail());
        }
        if (!stderr.tail().isBlank()) {
            parts.add("stderr: " + stderr.tail());
        }
        return parts.isEmpty() ? "" : " (" + String.join("; ", parts) + ")";
    }

    private static void deleteQuietly(Path dir) {
        if (dir == null || !Files.exists(dir)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            walk.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException ex) {
                    LOGGER.fine(() -> "Could not delete " + p + ": " + ex.getMessage());
                }
            });
        } catch (IOException ex) {
            LOGGER.fine(() -> "Could not clean LibreOffice profile " + dir + ": " + ex.getMessage());
        }
    }
}
