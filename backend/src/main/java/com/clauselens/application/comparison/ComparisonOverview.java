package com.clauselens.application.comparison;

import com.clauselens.domain.comparison.model.Comparison;
import com.clauselens.domain.contract.model.Contract;

/**
 * Comparison with its two contracts. A contract is null only if it was removed out of band.
 */
public record ComparisonOverview(Comparison comparison, Contract sourceContract, Contract targetContract) {}
