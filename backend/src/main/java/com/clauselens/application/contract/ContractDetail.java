package com.clauselens.application.contract;

import com.clauselens.domain.contract.model.Clause;
import com.clauselens.domain.contract.model.Contract;

import java.util.List;

public record ContractDetail(Contract contract, List<Clause> clauses) {}
