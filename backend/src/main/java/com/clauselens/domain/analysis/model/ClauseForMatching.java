package com.clauselens.domain.analysis.model;

import com.clauselens.domain.contract.model.ClauseType;

/**
 * Clause view sent to the semantic matcher. Title falls back to the type code.
 */
public record ClauseForMatching(String id, ClauseType clauseType, String title, String content) {}
