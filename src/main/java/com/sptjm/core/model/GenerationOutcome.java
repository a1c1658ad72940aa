package com.sptjm.core.model;

/**
 * Result of rendering and converting one record's letter.
 *
 * @param documentName file name of the final PDF, only set on success
 * @param reason       {@code <ReasonCode>: <message>}, only set on failure
 */
public record GenerationOutcome(String recordId,
                                String name,
                                GenerationStatus status,
                                String documentName,
                                String reason) {

    public static GenerationOutcome success(LetterRecord record, String documentName) {
        return new GenerationOutcome(record.id(), record.name(), GenerationStatus.SUCCESS, documentName, "");
    }

    public static GenerationOutcome failure(LetterRecord record, String reason) {
        return new GenerationOutcome(record.id(), record.name(), GenerationStatus.FAILED, null, reason == null ? "" : reason);
    }

    public boolean isSuccess() {
        return status == GenerationStatus.SUCCESS;
    }
}
