package com.sptjm.core.convert;

public class ConversionFailedException extends ConversionException {

    public ConversionFailedException(String message) {
        super(message);
    }

    public ConversionFailedException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String reasonCode() {
        return "ConversionFailed";
    }
}
