package com.sptjm.core.render;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Token rewriting shared by the letter template and the email templates.
 * Tokens whose key has no value are copied through untouched.
 */
public final class Placeholders {

    /**
     * Letter template grammar, e.g. {@code {{NAMA}}}.
     */
    public static final Pattern DOCUMENT = Pattern.compile("\\{\\{([A-Z][A-Z0-9_]*)\\}\\}");

    /**
     * Email subject/body grammar, e.g. {@code {nama}}.
     */
    public static final Pattern MESSAGE = Pattern.compile("\\{([a-z][a-z0-9_]*)\\}");

    private Placeholders() {
    }

    public static String substitute(String text, Pattern grammar, Map<String, String> values) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        Matcher matcher = grammar.matcher(text);
        StringBuilder out = new StringBuilder(text.length());
        while (matcher.find()) {
            String value = values.get(matcher.group(1));
            String replacement = value == null ? matcher.group() : value;
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    /**
     * Whether {@code text} contains a token for any of the given keys.
     */
    public static boolean mentionsAny(String text, Pattern grammar, Iterable<String> keys) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        Matcher matcher = grammar.matcher(text);
        while (matcher.find()) {
            for (String key : keys) {
                if (key.equals(matcher.group(1))) {
                    return true;
                }
            }
        }
        return false;
    }
}
