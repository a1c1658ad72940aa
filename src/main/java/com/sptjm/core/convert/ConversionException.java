package com.sptjm.core.convert;

import java.io.IOException;

/**
 * Base class for document conversion failures. {@link #reasonCode()} is what the generation report shows.
 */
public abstract class ConversionException extends IOException {

    protected ConversionException(String message) {
        super(message);
    }

    protected ConversionException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract String reasonCode();
}
