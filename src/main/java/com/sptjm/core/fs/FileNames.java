package com.sptjm.core.fs;

import com.sptjm.core.model.LetterRecord;

import java.text.Normalizer;
import java.util.Locale;

/**
 * Derives stable, filesystem safe document names from record identity.
 */
public final class FileNames {
    static final String PREFIX = "SPTJM";
    static final int MAX_BASE_LENGTH = 120;

    private FileNames() {
    }

    /**
     * {@code SPTJM_<slug(name)>_<id>} capped at 120 characters; identical input always gives the same name.
     * The name part is shortened first so the ID survives the cap.
     */
    public static String baseName(LetterRecord record) {
        String slug = slugify(record.name());
        String id = sanitizeId(record.id());
        int room = MAX_BASE_LENGTH - PREFIX.length() - id.length() - 2;
        if (room >= 0 && slug.length() > room) {
            slug = slug.substring(0, room).replaceAll("-+$", "");
        }
        String base = stripUnderscores(PREFIX + "_" + slug + "_" + id);
        if (base.length() > MAX_BASE_LENGTH) {
            base = base.substring(0, MAX_BASE_LENGTH);
        }
        return base;
    }

    public static String documentName(LetterRecord record, String extension) {
        String ext = extension.startsWith(".") ? extension.substring(1) : extension;
        return baseName(record) + "." + ext;
    }

    /**
     * ASCII, lowercase, words joined by {@code -}.
     */
    static String slugify(String input) {
        if (input == null || input.isBlank()) {
            return "";
        }
        String normalized = Normalizer.normalize(input, Normalizer.Form.NFKD)
            .replaceAll("\\p{InCombiningDiacriticalMarks}+", "");
        String slug = normalized.toLowerCase(Locale.ROOT)
            .replace('\'', ' ')
            .replaceAll("[^a-z0-9]+", "-");
        return slug.replaceAll("^-+|-+$", "");
    }

    private static String sanitizeId(String id) {
        return id == null ? "" : id.trim().replaceAll("[^A-Za-z0-9._-]", "-");
    }

    private static String stripUnderscores(String value) {
        return value.replaceAll("^_+|_+$", "");
    }
}
