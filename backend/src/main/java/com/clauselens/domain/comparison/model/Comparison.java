package com.clauselens.domain.comparison.model;

import com.clauselens.domain.common.model.AssignedIdEntity;
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

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * One comparison job. Rows in {@link ComparisonStatus#PROCESSING} double as the work queue:
 * the lease columns record which worker currently owns the run.
 */
@Entity
@Table(name = "comparisons")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Comparison extends AssignedIdEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(nullable = false, length = 100)
    private String orgId;

    @Column(length = 200)
    private String name;

    @Column(nullable = false, length = 36)
    private String sourceContractId;

    @Column(nullable = false, length = 36)
    private String targetContractId;

    @Enumerated(EnumType.STRING)
    @Column(length = 30)
    private ComparisonType comparisonType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ComparisonStatus status;

    private Integer overallRiskScore;

    @Column(columnDefinition = "text")
    private String summary;

    @Convert(converter = JsonStringListConverter.class)
    @Column(columnDefinition = "text")
    private List<String> semanticTags;

    @Column(columnDefinition = "text")
    private String errorMessage;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    private LocalDateTime completedAt;

    @Column(length = 80)
    private String leaseOwner;

    private LocalDateTime leaseExpiresAt;

    @Column(nullable = false)
    private int attempts;

    @Builder
    public Comparison(String orgId, String name, String sourceContractId, String targetContractId,
                      ComparisonType comparisonType) {
        this.id = UUID.randomUUID().toString();
        this.orgId = orgId;
        this.name = name;
        this.sourceContractId = sourceContractId;
        this.targetContractId = targetContractId;
        this.comparisonType = comparisonType != null ? comparisonType : ComparisonType.TEMPLATE_VS_REDLINE;
        this.status = ComparisonStatus.PROCESSING;
        this.createdAt = LocalDateTime.now();
    }

    public boolean isProcessing() {
        return status == ComparisonStatus.PROCESSING;
    }

    public boolean isLeasedBy(String owner) {
        return owner != null && owner.equals(leaseOwner);
    }

    public void complete(int overallRiskScore, String summary, List<String> semanticTags) {
        requireProcessing();
        this.overallRiskScore = overallRiskScore;
        this.summary = summary;
        this.semanticTags = semanticTags;
        this.status = ComparisonStatus.COMPLETED;
        this.completedAt = LocalDateTime.now();
        releaseLease();
    }

    public void fail(String errorMessage) {
        requireProcessing();
        this.errorMessage = errorMessage;
        this.status = ComparisonStatus.FAILED;
        this.completedAt = LocalDateTime.now();
        releaseLease();
    }

    public void rename(String name) {
        this.name = name;
    }

    private void releaseLease() {
        this.leaseOwner = null;
        this.leaseExpiresAt = null;
    }

    private void requireProcessing() {
        if (status.isTerminal()) {
            throw new IllegalStateException("Comparison " + id + " is already " + status.code());
        }
    }
}
