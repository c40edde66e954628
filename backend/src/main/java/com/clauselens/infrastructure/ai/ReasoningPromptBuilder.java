package com.clauselens.infrastructure.ai;

import com.clauselens.domain.analysis.model.ClauseForMatching;
import com.clauselens.domain.analysis.model.ClauseResultSummary;
import com.clauselens.domain.analysis.service.ReasoningServiceException;
import com.clauselens.domain.contract.model.ClauseType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Component
@RequiredArgsConstructor
public class ReasoningPromptBuilder {

    static final int MATCHING_CONTENT_LIMIT = 2000;

    private final ObjectMapper objectMapper;

    private static final String EXTRACTION_SYSTEM_PROMPT = """
            You are a legal analyst who splits contracts into clauses.

            First identify the document's own numbering scheme (1., 1.1, Article I, Section A, (a), roman numerals)
            and use it to decide where each clause starts and ends. A clause starts at its heading and runs until
            the next heading of the same level. Keep every subsection inside its parent clause.

            For every clause report:
            - clause_type: one of [%s]; pick the closest one when nothing fits exactly
            - title: the heading exactly as written, section number included
            - content: the complete verbatim clause text, never summarised or truncated
            - page_number: the page, when it can be told from the text
            - confidence: 0 to 1

            Report each clause type once unless the document really contains distinct provisions of that type.
            Apply the same granularity to every document so two versions of one contract can be compared.

            Reply with a JSON array only:
            [{"clause_type": "indemnification", "title": "Section 8 - Indemnification", "content": "...", "page_number": 5, "confidence": 0.95}]""";

    private static final String MATCHING_SYSTEM_PROMPT = """
            You are a legal analyst who pairs clauses of an original contract (SOURCE) with the clauses of its
            revised version (TARGET).

            Priority order:
            1. Same clause type: pair them.
            2. Same section number or heading ("Section 5" and "5.", "Article V" and "ARTICLE 5").
            3. Same legal subject under a different label (indemnity and hold harmless, liability cap and
               limitation of liability, non-disclosure and confidentiality, choice of law and governing law).

            Every source clause should be paired unless the target really lacks that provision.
            Each target clause may be used once. Use a null targetClauseId for a source clause without counterpart.

            Reply with JSON only:
            {
              "matches": [{"sourceClauseId": "...", "targetClauseId": "...", "matchConfidence": 0.95, "matchReason": "..."}],
              "unmatchedSource": [],
              "unmatchedTarget": []
            }""";

    private static final String RISK_SYSTEM_PROMPT = """
            You are a contract reviewer. Compare the original clause with its redlined version and score how
            much the legal substance changed.

            deviation_percentage: share of meaningful wording changed.
            0-5 formatting only, 5-15 rewording without new meaning, 15-35 modified terms,
            35-60 restructuring or new terms, 60-100 rewrite or contradiction.

            risk_score: start at 0 and add points per change found.
            Scope of obligations +10-25, financial terms (caps, damages, fees) +15-30, durations +5-15,
            notice periods +5-10, definitions +5-20, rights or obligations added +10-25,
            rights or obligations removed +10-30, carve-outs or exceptions +10-20. Cap at 100.

            risk_level: 0-20 low, 21-50 medium, 51-75 high, 76-100 critical.

            Judge legal substance, not formatting. Score identical kinds of change identically.
            Use neutral, factual language.

            Reply with JSON only:
            {
              "risk_level": "high",
              "risk_score": 70,
              "deviation_percentage": 40,
              "risk_factors": ["Broader indemnification scope (+20)"],
              "summary": "One or two sentences describing the change."
            }""";

    private static final String SUMMARY_SYSTEM_PROMPT = """
            You are a legal analyst writing the executive summary of a contract comparison.

            Write 3 to 5 findings, one sentence each, as plain prose without markdown, bullets or headings.
            State observations only and give no recommendations.
            Whenever a finding names a clause, write its clause type in double brackets, for example
            [[indemnification]] or [[limitation_of_liability]], using the exact type values supplied.""";

    private static final String TAGS_SYSTEM_PROMPT = """
            You label contract comparisons for filtering. Produce between 3 and 6 short lowercase tags
            (one to three words, hyphen separated) describing the agreement kind, the clause areas that
            changed and the overall risk band.

            Reply with JSON only:
            {"tags": ["nda", "confidentiality-expanded", "high-risk"]}""";

    public String extractionSystemPrompt() {
        return EXTRACTION_SYSTEM_PROMPT.formatted(ClauseType.vocabulary());
    }

    public String matchingSystemPrompt() {
        return MATCHING_SYSTEM_PROMPT;
    }

    public String riskSystemPrompt() {
        return RISK_SYSTEM_PROMPT;
    }

    public String summarySystemPrompt() {
        return SUMMARY_SYSTEM_PROMPT;
    }

    public String tagsSystemPrompt() {
        return TAGS_SYSTEM_PROMPT;
    }

    public String buildExtractionUserMessage(String contractText) {
        return "Extract every clause of this contract with its complete text, subsections included.\n\n" + contractText;
    }

    public String buildMatchingUserMessage(List<ClauseForMatching> source, List<ClauseForMatching> target) {
        return "SOURCE clauses (original), count " + source.size() + ":\n"
                + toJson(source.stream().map(ReasoningPromptBuilder::matchingView).toList())
                + "\n\nTARGET clauses (revised), count " + target.size() + ":\n"
                + toJson(target.stream().map(ReasoningPromptBuilder::matchingView).toList())
                + "\n\nA redline usually keeps a modified version of every original clause. "
                + "Pair each source clause with the target clause covering the same provision.";
    }

    public String buildRiskUserMessage(String sourceText, String targetText, ClauseType clauseType) {
        return "Clause type: " + clauseType.code() + "\n\n"
                + "ORIGINAL VERSION:\n" + sourceText + "\n\n"
                + "REDLINED VERSION:\n" + targetText;
    }

    public String buildSummaryUserMessage(String sourceLabel, String targetLabel, List<ClauseResultSummary> results) {
        StringBuilder sb = new StringBuilder();
        sb.append("Comparison: \"").append(sourceLabel).append("\" vs \"").append(targetLabel).append("\"\n");
        sb.append("Clause types: ").append(results.stream()
                .map(r -> r.clauseType().code())
                .distinct()
                .collect(Collectors.joining(", "))).append("\n\n");
        sb.append("Clause results:\n");
        for (ClauseResultSummary result : results) {
            sb.append("- ").append(result.clauseType().code()).append(": ").append(result.status().code());
            if (result.riskScore() != null && result.riskScore() > 0) {
                sb.append(" (risk ").append(result.riskScore()).append("/100)");
            }
            if (result.summary() != null && !result.summary().isBlank()) {
                sb.append(" - ").append(result.summary());
            }
            sb.append("\n");
        }
        return sb.toString();
    }

    public String buildTagsUserMessage(String sourceLabel, String targetLabel,
                                       List<ClauseType> clauseTypes, int overallRiskScore) {
        return "Comparison: \"" + sourceLabel + "\" vs \"" + targetLabel + "\"\n"
                + "Clause types: " + clauseTypes.stream().map(ClauseType::code).collect(Collectors.joining(", ")) + "\n"
                + "Overall risk score: " + overallRiskScore + "/100";
    }

    private static Map<String, Object> matchingView(ClauseForMatching clause) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", clause.id());
        view.put("type", clause.clauseType().code());
        view.put("title", clause.title());
        view.put("content", truncate(clause.content()));
        return view;
    }

    static String truncate(String content) {
        if (content == null || content.length() <= MATCHING_CONTENT_LIMIT) {
            return content;
        }
        return content.substring(0, MATCHING_CONTENT_LIMIT) + "... [truncated]";
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new ReasoningServiceException("Failed to serialise clauses for matching", e);
        }
    }
}
