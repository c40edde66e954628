package com.clauselens.application.comparison;

import com.clauselens.domain.comparison.model.ClauseComparison;
import com.clauselens.domain.comparison.model.Comparison;
import com.clauselens.domain.contract.model.Clause;
import com.clauselens.domain.contract.model.Contract;

import java.util.List;

/**
 * Full comparison view. {@code clauseComparisons} stays empty while the run is processing.
 */
public record ComparisonDetail(
        Comparison comparison,
        Contract sourceContract,
        Contract targetContract,
        List<Clause> sourceClauses,
        List<Clause> targetClauses,
        List<ClauseComparison> clauseComparisons
) {}
