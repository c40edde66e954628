package com.clauselens.infrastructure.ai;

import com.clauselens.domain.analysis.model.ClauseForMatching;
import com.clauselens.domain.analysis.model.ClauseMatchingResult;
import com.clauselens.domain.analysis.model.ClauseResultSummary;
import com.clauselens.domain.analysis.model.ExtractedClause;
import com.clauselens.domain.analysis.model.RiskAnalysis;
import com.clauselens.domain.analysis.service.ClauseReasoningService;
import com.clauselens.domain.analysis.service.ReasoningServiceException;
import com.clauselens.domain.contract.model.ClauseType;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.openai.client.OpenAIClient;
import com.openai.models.ResponseFormatJsonObject;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link ClauseReasoningService} over any OpenAI-compatible chat completions endpoint.
 * Every call runs at temperature 0.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AiClauseReasoningService implements ClauseReasoningService {

    private static final double TEMPERATURE = 0.0;
    private static final int EXTRACTION_MAX_TOKENS = 16000;
    private static final int MATCHING_MAX_TOKENS = 4000;
    private static final int RISK_MAX_TOKENS = 2000;
    private static final int SUMMARY_MAX_TOKENS = 300;
    private static final int TAGS_MAX_TOKENS = 200;

    private final OpenAIClient openAIClient;
    private final ReasoningPromptBuilder promptBuilder;
    private final ReasoningResponseParser responseParser;
    private final ReasoningUsageTracker usageTracker;

    @Value("${reasoning.model}")
    private String model;

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TagsReply(List<String> tags) {}

    @Override
    public List<ExtractedClause> extractClauses(String contractText) {
        log.info("[Reasoning] Extracting clauses - textLength: {}", contractText.length());
        LlmCallResult result = call("extraction", promptBuilder.extractionSystemPrompt(),
                promptBuilder.buildExtractionUserMessage(contractText), EXTRACTION_MAX_TOKENS, null);
        List<ExtractedClause> clauses = responseParser.parseArray(result.content(), ExtractedClause.class).stream()
                .filter(Objects::nonNull)
                .toList();
        log.info("[Reasoning] Extraction returned {} clause candidates", clauses.size());
        return clauses;
    }

    @Override
    public ClauseMatchingResult matchClauses(List<ClauseForMatching> sourceClauses,
                                             List<ClauseForMatching> targetClauses) {
        LlmCallResult result = call("matching", promptBuilder.matchingSystemPrompt(),
                promptBuilder.buildMatchingUserMessage(sourceClauses, targetClauses), MATCHING_MAX_TOKENS,
                ResponseFormatJsonObject.builder().build());
        return responseParser.parseObject(result.content(), ClauseMatchingResult.class);
    }

    @Override
    public RiskAnalysis analyzeClauseRisk(String sourceText, String targetText, ClauseType clauseType) {
        LlmCallResult result = call("risk", promptBuilder.riskSystemPrompt(),
                promptBuilder.buildRiskUserMessage(sourceText, targetText, clauseType), RISK_MAX_TOKENS,
                ResponseFormatJsonObject.builder().build());
        return responseParser.parseObject(result.content(), RiskAnalysis.class);
    }

    @Override
    public String generateComparisonSummary(String sourceLabel, String targetLabel,
                                            List<ClauseResultSummary> results) {
        LlmCallResult result = call("summary", promptBuilder.summarySystemPrompt(),
                promptBuilder.buildSummaryUserMessage(sourceLabel, targetLabel, results), SUMMARY_MAX_TOKENS, null);
        String summary = result.content().trim();
        if (summary.isEmpty()) {
            throw new ReasoningServiceException("Summary reply was empty");
        }
        return summary;
    }

    @Override
    public List<String> generateSemanticTags(String sourceLabel, String targetLabel,
                                             List<ClauseType> clauseTypes, int overallRiskScore) {
        LlmCallResult result = call("tags", promptBuilder.tagsSystemPrompt(),
                promptBuilder.buildTagsUserMessage(sourceLabel, targetLabel, clauseTypes, overallRiskScore),
                TAGS_MAX_TOKENS, ResponseFormatJsonObject.builder().build());
        TagsReply reply = responseParser.parseObject(result.content(), TagsReply.class);
        if (reply.tags() == null) {
            return List.of();
        }
        return reply.tags().stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(tag -> !tag.isEmpty())
                .distinct()
                .toList();
    }

    /**
     * Raw chat completion call.
     *
     * @param responseFormat JSON object format, or null for free text and JSON arrays
     */
    LlmCallResult call(String operation, String systemPrompt, String userMessage,
                       int maxTokens, ResponseFormatJsonObject responseFormat) {
        try {
            var builder = ChatCompletionCreateParams.builder()
                    .model(model)
                    .temperature(TEMPERATURE)
                    .maxCompletionTokens(maxTokens)
                    .addSystemMessage(systemPrompt)
                    .addUserMessage(userMessage);

            if (responseFormat != null) {
                builder.responseFormat(responseFormat);
            }

            ChatCompletion completion = openAIClient.chat().completions().create(builder.build());

            long promptTokens = 0;
            long completionTokens = 0;
            if (completion.usage().isPresent()) {
                promptTokens = completion.usage().get().promptTokens();
                completionTokens = completion.usage().get().completionTokens();
            }

            Optional<String> content = completion.choices().stream()
                    .findFirst()
                    .flatMap(choice -> choice.message().content());
            if (content.isEmpty()) {
                usageTracker.recordFailure(operation, promptTokens, completionTokens);
                throw new ReasoningServiceException("Reasoning reply for " + operation + " had no content");
            }
            usageTracker.recordUsage(operation, promptTokens, completionTokens);

            return new LlmCallResult(content.get(), promptTokens, completionTokens);
        } catch (ReasoningServiceException e) {
            throw e;
        } catch (Exception e) {
            usageTracker.recordFailure(operation, 0, 0);
            log.error("[Reasoning] {} call failed", operation, e);
            throw new ReasoningServiceException("Reasoning service call failed: " + operation, e);
        }
    }
}
