package com.clauselens.interfaces.api.dto;

import com.clauselens.application.contract.ContractDetail;

import java.util.List;

public record ContractDetailResponse(ContractResponse contract, List<ClauseResponse> clauses) {

    public static ContractDetailResponse from(ContractDetail detail) {
        return new ContractDetailResponse(ContractResponse.from(detail.contract()),
                detail.clauses().stream().map(ClauseResponse::from).toList());
    }
}
