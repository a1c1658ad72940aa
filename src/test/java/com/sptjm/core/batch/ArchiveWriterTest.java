package com.sptjm.core.batch;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.zip.ZipFile;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ArchiveWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void sameFilesGiveByteIdenticalArchives() throws IOException {
        Path a = Files.writeString(tempDir.resolve("SPTJM_a_1.pdf"), "one");
        Path b = Files.writeString(tempDir.resolve("SPTJM_b_2.pdf"), "two");

        ArchiveWriter.write(tempDir.resolve("first.zip"), List.of(a, b));
        ArchiveWriter.write(tempDir.resolve("second.zip"), List.of(a, b));

        assertArrayEquals(Files.readAllBytes(tempDir.resolve("first.zip")), Files.readAllBytes(tempDir.resolve("second.zip")));
        try (ZipFile zip = new ZipFile(tempDir.resolve("first.zip").toFile())) {
            assertEquals(List.of("SPTJM_a_1.pdf", "SPTJM_b_2.pdf"),
                Collections.list(zip.entries()).stream().map(e -> e.getName()).toList());
        }
    }

    @Test
    void emptyListStillWritesAnArchive() throws IOException {
        Path target = tempDir.resolve("out/empty.zip");

        ArchiveWriter.write(target, List.of());

        try (ZipFile zip = new ZipFile(target.toFile())) {
            assertEquals(0, zip.size());
        }
    }

    @Test
    void duplicateEntryNamesAreRejected() throws IOException {
        Path first = Files.writeString(Files.createDirectories(tempDir.resolve("x")).resolve("same.pdf"), "1");
        Path second = Files.writeString(Files.createDirectories(tempDir.resolve("y")).resolve("same.pdf"), "2");

        assertThrows(IOException.class, () -> ArchiveWriter.write(tempDir.resolve("dup.zip"), List.of(first, second)));
    }
}
