package com.clauselens.application.common;

import java.util.regex.Pattern;

/**
 * Strips markup that could execute when user-supplied text is rendered back in a browser.
 */
public final class InputSanitizer {

    private static final Pattern SCRIPT_BLOCK =
            Pattern.compile("<script\\b[^<]*(?:(?!</script>)<[^<]*)*</script>", Pattern.CASE_INSENSITIVE);
    private static final Pattern JAVASCRIPT_PROTOCOL = Pattern.compile("javascript:", Pattern.CASE_INSENSITIVE);
    private static final Pattern EVENT_HANDLER = Pattern.compile("\\bon\\w+\\s*=", Pattern.CASE_INSENSITIVE);

    private InputSanitizer() {
    }

    public static String sanitize(String value) {
        if (value == null) {
            return null;
        }
        String cleaned = SCRIPT_BLOCK.matcher(value).replaceAll("");
        cleaned = JAVASCRIPT_PROTOCOL.matcher(cleaned).replaceAll("");
        cleaned = EVENT_HANDLER.matcher(cleaned).replaceAll("");
        return cleaned.trim();
    }

    /**
     * Like {@link #sanitize(String)}, but blank results become null.
     */
    public static String sanitizeOptional(String value) {
        String cleaned = sanitize(value);
        return cleaned == null || cleaned.isEmpty() ? null : cleaned;
    }
}
