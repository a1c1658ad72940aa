package com.sptjm.config;

import java.time.Duration;

/**
 * Outbound mail settings read once at startup.
 */
public record SmtpSettings(String host,
                           int port,
                           String user,
                           String password,
                           String fromName,
                           Duration timeout) {

    public static final int DEFAULT_PORT = 587;

    public boolean isComplete() {
        return notBlank(host) && notBlank(user) && notBlank(password);
    }

    /**
     * Display form used for the From header, e.g. {@code LPPM <noreply@example.ac.id>}.
     */
    public String fromHeader() {
        String name = notBlank(fromName) ? fromName.trim() : user;
        return (name + " <" + user + ">").trim();
    }

    @Override
    public String toString() {
        return "SmtpSettings[host=%s, port=%d, user=%s, fromName=%s]".formatted(host, port, user, fromName);
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
