package com.clauselens.infrastructure.analysis.preprocessing;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonicalizes contract and clause text so comparison does not depend on source formatting:
 * - Line endings unified to \n
 * - Horizontal whitespace runs collapsed to one space
 * - Every line trimmed
 * - 3+ newlines collapsed to a paragraph break
 * - Whole result trimmed
 *
 * Idempotent: normalize(normalize(x)) equals normalize(x).
 */
@Component
public class TextNormalizer {

    private static final Pattern LINE_BREAKS = Pattern.compile("\\r\\n|[\\r\\u0085\\u2028\\u2029]");

    private static final Pattern HORIZONTAL_WHITESPACE = Pattern.compile("[ \\t\\x0B\\f\\u00A0]+");

    // Spaces touching a newline
    private static final Pattern LINE_EDGE_SPACES = Pattern.compile(" *\\n *");

    private static final Pattern EXCESSIVE_NEWLINES = Pattern.compile("\\n{3,}");

    /**
     * Normalize the text.
     *
     * @param text raw text (nullable)
     * @return normalized text, or the input itself when null or empty
     */
    public String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }

        // 1. \r\n, lone \r and Unicode line separators to \n
        String result = LINE_BREAKS.matcher(text).replaceAll("\n");

        // 2. Collapse spaces/tabs to a single space
        result = HORIZONTAL_WHITESPACE.matcher(result).replaceAll(" ");

        // 3. Trim each line
        result = LINE_EDGE_SPACES.matcher(result).replaceAll("\n");

        // 4. Collapse 3+ newlines to 2
        result = EXCESSIVE_NEWLINES.matcher(result).replaceAll("\n\n");

        // 5. Trim
        return result.strip();
    }

    /**
     * Lower-cased normalized form used for fingerprinting.
     */
    public String fingerprint(String text) {
        String normalized = normalize(text == null ? "" : text.toLowerCase(Locale.ROOT));
        return normalized == null ? "" : normalized;
    }
}
