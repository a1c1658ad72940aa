package com.sptjm.core.batch;

import org.apache.pdfbox.io.MemoryUsageSetting;
import org.apache.pdfbox.multipdf.PDFMergerUtility;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Concatenates the sample letters into one PDF so they can be checked in a single viewer window.
 */
public final class SamplePreviewMerger {

    private SamplePreviewMerger() {
    }

    public static void merge(List<Path> letters, Path outFile) throws IOException {
        if (letters == null || letters.isEmpty()) {
            Files.deleteIfExists(outFile);
            return;
        }
        PDFMergerUtility mu = new PDFMergerUtility();
        mu.setDestinationFileName(outFile.toString());
        for (Path letter : letters) {
            mu.addSource(letter.toFile());
        }
        mu.mergeDocuments(MemoryUsageSetting.setupMainMemoryOnly());
    }
}
