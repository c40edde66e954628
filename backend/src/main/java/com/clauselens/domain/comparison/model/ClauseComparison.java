package com.clauselens.domain.comparison.model;

import com.clauselens.domain.common.model.AssignedIdEntity;
import com.clauselens.domain.contract.model.ClauseType;
import com.clauselens.infrastructure.persistence.JsonStringListConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "clause_comparisons")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ClauseComparison extends AssignedIdEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(nullable = false, length = 36)
    private String comparisonId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 40)
    private ClauseType clauseType;

    @Column(length = 36)
    private String sourceClauseId;

    @Column(length = 36)
    private String targetClauseId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private ClauseComparisonStatus status;

    private Integer riskScore;

    @Convert(converter = JsonStringListConverter.class)
    @Column(columnDefinition = "text")
    private List<String> riskFactors;

    private Double deviationPercentage;

    @Column(columnDefinition = "text")
    private String diffSummary;

    @Builder
    public ClauseComparison(String comparisonId, ClauseType clauseType, String sourceClauseId,
                            String targetClauseId, ClauseComparisonStatus status, Integer riskScore,
                            List<String> riskFactors, Double deviationPercentage, String diffSummary) {
        if (sourceClauseId == null && targetClauseId == null) {
            throw new IllegalArgumentException("A clause comparison needs a source or a target clause");
        }
        this.id = UUID.randomUUID().toString();
        this.comparisonId = comparisonId;
        this.clauseType = clauseType;
        this.sourceClauseId = sourceClauseId;
        this.targetClauseId = targetClauseId;
        this.status = status;
        this.riskScore = riskScore;
        this.riskFactors = riskFactors;
        this.deviationPercentage = deviationPercentage;
        this.diffSummary = diffSummary;
    }
}
