package com.clauselens.domain.analysis.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RiskAnalysis(
        @JsonProperty("risk_level") String riskLevel,
        @JsonProperty("risk_score") int riskScore,
        @JsonProperty("deviation_percentage") Double deviationPercentage,
        @JsonProperty("risk_factors") List<String> riskFactors,
        @JsonProperty("summary") String summary
) {
    public RiskAnalysis {
        riskScore = Math.max(0, Math.min(100, riskScore));
        riskFactors = riskFactors != null ? List.copyOf(riskFactors) : List.of();
    }
}
