package com.sptjm.core.batch;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Packs generated letters into a zip, one flat entry per file, in the order given.
 */
public final class ArchiveWriter {
    // earliest DOS timestamp, in local time as the zip format stores it
    private static final long FIXED_ENTRY_TIME = LocalDateTime.of(1980, 1, 1, 0, 0)
        .atZone(ZoneId.systemDefault())
        .toInstant()
        .toEpochMilli();

    private ArchiveWriter() {
    }

    /**
     * Writes {@code target}; an empty list still produces a valid, empty archive.
     * Entries carry a fixed timestamp so identical inputs give identical entry metadata.
     */
    public static void write(Path target, List<Path> files) throws IOException {
        Path parent = target.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Set<String> names = new HashSet<>();
        try (OutputStream out = Files.newOutputStream(target);
             ZipOutputStream zip = new ZipOutputStream(out)) {
            for (Path file : files) {
                String name = file.getFileName().toString();
                if (!names.add(name)) {
                    throw new IOException("Duplicate archive entry: " + name);
                }
                ZipEntry entry = new ZipEntry(name);
                entry.setTime(FIXED_ENTRY_TIME);
                zip.putNextEntry(entry);
                Files.copy(file, zip);
                zip.closeEntry();
            }
        }
    }
}
