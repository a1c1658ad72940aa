package com.sptjm.core.model;

import java.time.Instant;

/**
 * Result of sending, simulating or skipping one letter email.
 */
public record DispatchOutcome(String recordId,
                              String name,
                              String address,
                              DispatchStatus status,
                              Instant timestamp,
                              String detail) {

    public DispatchOutcome {
        address = address == null ? "" : address;
        detail = detail == null ? "" : detail;
    }
}
