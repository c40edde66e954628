package com.clauselens.domain.contract.model;

import com.clauselens.domain.common.model.AssignedIdEntity;
import jakarta.persistence.Column;
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
import java.util.UUID;

@Entity
@Table(name = "clauses")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Clause extends AssignedIdEntity {

    public static final int TITLE_MAX_LENGTH = 500;

    @Id
    @Column(length = 36)
    private String id;

    @Column(nullable = false, length = 36)
    private String contractId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 40)
    private ClauseType clauseType;

    @Column(length = TITLE_MAX_LENGTH)
    private String title;

    @Column(nullable = false, columnDefinition = "text")
    private String content;

    private Integer pageNumber;

    private Double confidenceScore;

    @Column(nullable = false, updatable = false)
    private LocalDateTime extractedAt;

    @Builder
    public Clause(String id, String contractId, ClauseType clauseType, String title,
                  String content, Integer pageNumber, Double confidenceScore) {
        this.id = id != null ? id : UUID.randomUUID().toString();
        this.contractId = contractId;
        this.clauseType = clauseType != null ? clauseType : ClauseType.UNKNOWN;
        this.title = title;
        this.content = content;
        this.pageNumber = pageNumber;
        this.confidenceScore = confidenceScore;
        this.extractedAt = LocalDateTime.now();
    }
}
