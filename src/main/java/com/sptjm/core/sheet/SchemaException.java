package com.sptjm.core.sheet;

/**
 * Raised when an input sheet lacks the structure needed to start a run.
 */
public class SchemaException extends Exception {

    public SchemaException(String message) {
        super(message);
    }
}
