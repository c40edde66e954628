package com.clauselens.interfaces.api.dto;

import com.clauselens.domain.contract.model.Contract;
import com.clauselens.domain.contract.model.IngestionStatus;

import java.time.LocalDateTime;

public record ContractResponse(
        String id,
        String orgId,
        String name,
        String filename,
        String contentType,
        IngestionStatus ingestionStatus,
        boolean isTemplate,
        String templateType,
        LocalDateTime uploadedAt,
        LocalDateTime processedAt
) {
    public static ContractResponse from(Contract contract) {
        if (contract == null) {
            return null;
        }
        return new ContractResponse(contract.getId(), contract.getOrgId(), contract.getName(),
                contract.getFilename(), contract.getContentType(), contract.getIngestionStatus(),
                contract.isTemplate(), contract.getTemplateType(), contract.getUploadedAt(), contract.getProcessedAt());
    }
}
