package com.sptjm.core.convert;

import java.nio.file.Path;

/**
 * Turns an intermediate {@code .docx} into the final PDF.
 */
public interface DocumentConverter {

    /**
     * Fails fast when the converter itself cannot be reached.
     */
    default void verify() throws ConverterNotFoundException {
    }

    /**
     * Converts one document. The source is left in place.
     *
     * @return the PDF written to {@code targetDir}, non-empty
     */
    Path convert(Path document, Path targetDir) throws ConversionException;
}
