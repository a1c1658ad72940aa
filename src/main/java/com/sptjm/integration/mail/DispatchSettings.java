package com.sptjm.integration.mail;

import java.time.Duration;
import java.util.Objects;
import java.util.Set;

/**
 * @param subjectTemplate subject with {@code {key}} tokens
 * @param bodyTemplate    plain-text body with {@code {key}} tokens
 * @param delay           pause before every send attempt after the first
 * @param alreadySentIds  IDs delivered by an earlier run, skipped this time
 */
public record DispatchSettings(DispatchMode mode,
                               String subjectTemplate,
                               String bodyTemplate,
                               Duration delay,
                               Set<String> alreadySentIds) {

    public static final String DEFAULT_SUBJECT = "SPTJM - {nama} ({nip})";
    public static final String DEFAULT_BODY = "Yth. Bapak/Ibu {nama},\n\nBerikut kami kirimkan file SPTJM (PDF).\n\nTerima kasih.\n";

    public DispatchSettings {
        Objects.requireNonNull(mode, "mode");
        subjectTemplate = subjectTemplate == null || subjectTemplate.isBlank() ? DEFAULT_SUBJECT : subjectTemplate;
        bodyTemplate = bodyTemplate == null || bodyTemplate.isBlank() ? DEFAULT_BODY : bodyTemplate;
        delay = delay == null || delay.isNegative() ? Duration.ZERO : delay;
        alreadySentIds = alreadySentIds == null ? Set.of() : Set.copyOf(alreadySentIds);
    }

    public static DispatchSettings defaults(DispatchMode mode, Duration delay) {
        return new DispatchSettings(mode, DEFAULT_SUBJECT, DEFAULT_BODY, delay, Set.of());
    }
}
