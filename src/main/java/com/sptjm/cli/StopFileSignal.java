package com.sptjm.cli;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.BooleanSupplier;

/**
 * Stop request raised by creating a file; checked between records.
 */
final class StopFileSignal implements BooleanSupplier {
    private final Path stopFile;

    StopFileSignal(Path stopFile) {
        this.stopFile = stopFile;
    }

    @Override
    public boolean getAsBoolean() {
        return stopFile != null && Files.exists(stopFile);
    }
}
