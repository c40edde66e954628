package com.clauselens.domain.analysis.service;

import com.clauselens.domain.analysis.model.ClauseForMatching;
import com.clauselens.domain.analysis.model.ClauseMatchingResult;
import com.clauselens.domain.analysis.model.ClauseResultSummary;
import com.clauselens.domain.analysis.model.ExtractedClause;
import com.clauselens.domain.analysis.model.RiskAnalysis;
import com.clauselens.domain.contract.model.ClauseType;

import java.util.List;

/**
 * Natural-language reasoning the comparison pipeline delegates to an external service.
 * Calls may be slow, rate-limited and non-deterministic; every failure is reported as
 * {@link ReasoningServiceException}.
 */
public interface ClauseReasoningService {

    /**
     * Splits a contract into typed clause candidates.
     *
     * @param contractText normalized contract text
     * @return candidates, possibly containing duplicates
     */
    List<ExtractedClause> extractClauses(String contractText);

    /**
     * Pairs source clauses with the target clauses that address the same provision.
     */
    ClauseMatchingResult matchClauses(List<ClauseForMatching> sourceClauses,
                                      List<ClauseForMatching> targetClauses);

    /**
     * Scores the legal significance of the change between two versions of a clause.
     */
    RiskAnalysis analyzeClauseRisk(String sourceText, String targetText, ClauseType clauseType);

    /**
     * Executive summary of a finished comparison.
     *
     * @param sourceLabel display name of the template
     * @param targetLabel display name of the redline
     * @param results     per-clause outcomes, sorted by clause type
     */
    String generateComparisonSummary(String sourceLabel, String targetLabel, List<ClauseResultSummary> results);

    /**
     * Short classification tags for listing and filtering comparisons.
     */
    List<String> generateSemanticTags(String sourceLabel, String targetLabel,
                                      List<ClauseType> clauseTypes, int overallRiskScore);
}
