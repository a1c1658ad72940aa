package com.sptjm.core.convert;

import java.time.Duration;

public class ConversionTimeoutException extends ConversionException {
    private final Duration timeout;

    public ConversionTimeoutException(Duration timeout) {
        super("Converter did not finish within %ds and was terminated".formatted(timeout.toSeconds()));
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }

    @Override
    public String reasonCode() {
        return "ConversionTimeout";
    }
}
