package com.sptjm.core.model;

import java.util.Locale;

public enum DispatchStatus {
    OK("OK"),
    FAIL("FAIL"),
    SKIP("SKIP"),
    DRY_RUN("DRY-RUN");

    private final String label;

    DispatchStatus(String label) {
        this.label = label;
    }

    /**
     * Report spelling of the status.
     */
    public String label() {
        return label;
    }

    public static DispatchStatus fromLabel(String label) {
        if (label == null) {
            throw new IllegalArgumentException("Missing dispatch status");
        }
        String normalized = label.trim().toUpperCase(Locale.ROOT);
        for (DispatchStatus status : values()) {
            if (status.label.equals(normalized) || status.name().equals(normalized)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown dispatch status: " + label);
    }
}
