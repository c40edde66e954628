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
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

@Entity
@Table(name = "contracts")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Contract extends AssignedIdEntity {

    private static final Map<String, String> CONTENT_TYPES = Map.of(
            "pdf", "application/pdf",
            "doc", "application/msword",
            "docx", "application/vnd.openxmlformats-officedocument.wordprocessingml.document",
            "txt", "text/plain",
            "jpg", "image/jpeg",
            "jpeg", "image/jpeg",
            "png", "image/png"
    );

    @Id
    @Column(length = 36)
    private String id;

    @Column(nullable = false, length = 100)
    private String orgId;

    @Column(nullable = false, length = 200)
    private String name;

    @Column(nullable = false, length = 255)
    private String filename;

    @Column(length = 120)
    private String contentType;

    @Column(columnDefinition = "text")
    private String rawText;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private IngestionStatus ingestionStatus;

    @Column(nullable = false)
    private boolean template;

    @Column(length = 50)
    private String templateType;

    @Column(nullable = false, updatable = false)
    private LocalDateTime uploadedAt;

    private LocalDateTime processedAt;

    @Builder
    public Contract(String orgId, String name, String filename, String rawText,
                    boolean template, String templateType) {
        this.id = UUID.randomUUID().toString();
        this.orgId = orgId;
        this.filename = filename;
        this.name = name != null && !name.isBlank() ? name : stripExtension(filename);
        this.contentType = contentTypeOf(filename);
        this.rawText = rawText;
        this.template = template;
        this.templateType = templateType;
        this.ingestionStatus = IngestionStatus.PENDING;
        this.uploadedAt = LocalDateTime.now();
    }

    public boolean isCompleted() {
        return ingestionStatus == IngestionStatus.COMPLETED;
    }

    public void startProcessing(String text) {
        if (isCompleted()) {
            throw new IllegalStateException("Contract " + id + " is already completed");
        }
        if (text != null) {
            this.rawText = text;
        }
        this.ingestionStatus = IngestionStatus.PROCESSING;
    }

    public void markCompleted() {
        this.ingestionStatus = IngestionStatus.COMPLETED;
        this.processedAt = LocalDateTime.now();
    }

    public void markFailed() {
        if (isCompleted()) {
            return;
        }
        this.ingestionStatus = IngestionStatus.FAILED;
    }

    public void rename(String name) {
        this.name = name;
    }

    public void changeTemplate(boolean template, String templateType) {
        this.template = template;
        this.templateType = templateType;
    }

    static String contentTypeOf(String filename) {
        if (filename == null) {
            return "application/octet-stream";
        }
        int dot = filename.lastIndexOf('.');
        String ext = dot >= 0 ? filename.substring(dot + 1).toLowerCase(Locale.ROOT) : "";
        return CONTENT_TYPES.getOrDefault(ext, "application/octet-stream");
    }

    private static String stripExtension(String filename) {
        if (filename == null) {
            return "Untitled";
        }
        int dot = filename.lastIndexOf('.');
        return dot > 0 ? filename.substring(0, dot) : filename;
    }
}
