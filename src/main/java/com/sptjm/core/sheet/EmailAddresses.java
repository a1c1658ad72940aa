package com.sptjm.core.sheet;

import java.util.regex.Pattern;

/**
 * Loose address check; anything that is not {@code local@domain.tld} counts as no address.
 */
public final class EmailAddresses {
    private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");

    private EmailAddresses() {
    }

    /**
     * @return the trimmed address, or {@code null} when blank or malformed
     */
    public static String normalize(String raw) {
        if (raw == null) {
            return null;
        }
        String trimmed = raw.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        return EMAIL.matcher(trimmed).matches() ? trimmed : null;
    }
}
