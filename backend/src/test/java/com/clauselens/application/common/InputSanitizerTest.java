package com.clauselens.application.common;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class InputSanitizerTest {

    @Test
    @DisplayName("script blocks are removed with their content")
    void scriptBlocks() {
        assertThat(InputSanitizer.sanitize("Fee <SCRIPT type=\"x\">steal()</script>is due"))
                .isEqualTo("Fee is due");
    }

    @Test
    @DisplayName("javascript: and inline event handlers are removed")
    void protocolsAndHandlers() {
        assertThat(InputSanitizer.sanitize("<a href=\"javascript:go()\">link</a>"))
                .isEqualTo("<a href=\"go()\">link</a>");
        assertThat(InputSanitizer.sanitize("<img onerror = \"x\">")).isEqualTo("<img  \"x\">");
    }

    @Test
    @DisplayName("ordinary contract wording is left alone")
    void contractWording() {
        String clause = "Upon termination, the condition on payment = 30 days applies.";

        assertThat(InputSanitizer.sanitize(clause)).isEqualTo(clause);
    }

    @Test
    @DisplayName("blank results become null only in the optional variant")
    void optional() {
        assertThat(InputSanitizer.sanitize("   ")).isEmpty();
        assertThat(InputSanitizer.sanitizeOptional("   ")).isNull();
        assertThat(InputSanitizer.sanitizeOptional(null)).isNull();
        assertThat(InputSanitizer.sanitize(null)).isNull();
    }
}
