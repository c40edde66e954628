package com.clauselens.infrastructure.ai;

import com.clauselens.domain.analysis.model.ClauseForMatching;
import com.clauselens.domain.analysis.model.ClauseResultSummary;
import com.clauselens.domain.comparison.model.ClauseComparisonStatus;
import com.clauselens.domain.contract.model.ClauseType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ReasoningPromptBuilderTest {

    private ReasoningPromptBuilder promptBuilder;

    @BeforeEach
    void setUp() {
        promptBuilder = new ReasoningPromptBuilder(new ObjectMapper());
    }

    @Test
    @DisplayName("extraction prompt lists the clause vocabulary without the unknown type")
    void extractionVocabulary() {
        String prompt = promptBuilder.extractionSystemPrompt();

        assertThat(prompt).contains("indemnification, termination, ip_ownership");
        assertThat(prompt).contains("data_protection");
        assertThat(prompt).doesNotContain("%s");
        assertThat(ClauseType.vocabulary()).doesNotContain("unknown");
    }

    @Test
    @DisplayName("matching message carries ids, types and counts of both sides")
    void matchingMessage() {
        String message = promptBuilder.buildMatchingUserMessage(
                List.of(new ClauseForMatching("s1", ClauseType.TERMINATION, "12. Termination", "Either party may terminate.")),
                List.of(new ClauseForMatching("t1", ClauseType.TERMINATION, "termination", "Only the Customer may terminate."),
                        new ClauseForMatching("t2", ClauseType.NON_SOLICITATION, "14. No poaching", "No hiring of staff.")));

        assertThat(message).contains("SOURCE clauses (original), count 1");
        assertThat(message).contains("TARGET clauses (revised), count 2");
        assertThat(message).contains("\"id\" : \"s1\"", "\"type\" : \"non_solicitation\"");
    }

    @Test
    @DisplayName("long clause content is truncated for matching")
    void truncation() {
        String longContent = "x".repeat(ReasoningPromptBuilder.MATCHING_CONTENT_LIMIT + 50);

        String truncated = ReasoningPromptBuilder.truncate(longContent);

        assertThat(truncated).hasSize(ReasoningPromptBuilder.MATCHING_CONTENT_LIMIT + "... [truncated]".length());
        assertThat(truncated).endsWith("... [truncated]");
        assertThat(ReasoningPromptBuilder.truncate("short")).isEqualTo("short");
    }

    @Test
    @DisplayName("summary message lists every clause result and its risk")
    void summaryMessage() {
        String message = promptBuilder.buildSummaryUserMessage("MSA Template", "MSA Redline", List.of(
                new ClauseResultSummary(ClauseType.INDEMNIFICATION, ClauseComparisonStatus.SIGNIFICANT_CHANGE, 80, "Indemnity reversed."),
                new ClauseResultSummary(ClauseType.GOVERNING_LAW, ClauseComparisonStatus.IDENTICAL, 0, null)));

        assertThat(message).startsWith("Comparison: \"MSA Template\" vs \"MSA Redline\"");
        assertThat(message).contains("Clause types: indemnification, governing_law");
        assertThat(message).contains("- indemnification: significant_change (risk 80/100) - Indemnity reversed.");
        assertThat(message).contains("- governing_law: identical\n");
    }

    @Test
    @DisplayName("summary prompt asks for bracketed clause type references")
    void summaryPrompt() {
        assertThat(promptBuilder.summarySystemPrompt()).contains("[[indemnification]]");
        assertThat(promptBuilder.tagsSystemPrompt()).contains("\"tags\"");
    }

    @Test
    @DisplayName("tags message carries the overall risk score")
    void tagsMessage() {
        String message = promptBuilder.buildTagsUserMessage("NDA", "NDA v2",
                List.of(ClauseType.CONFIDENTIALITY, ClauseType.TERM_AND_RENEWAL), 62);

        assertThat(message).contains("Clause types: confidentiality, term_and_renewal");
        assertThat(message).endsWith("Overall risk score: 62/100");
    }
}
