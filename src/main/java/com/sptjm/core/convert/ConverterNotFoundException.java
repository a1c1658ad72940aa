package com.sptjm.core.convert;

public class ConverterNotFoundException extends ConversionException {

    public ConverterNotFoundException(String message) {
        super(message);
    }

    public ConverterNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String reasonCode() {
        return "ConverterNotFound";
    }
}
