package com.sptjm.core.model;

public enum GenerationStatus {
    SUCCESS,
    FAILED
}
