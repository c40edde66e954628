package com.clauselens.domain.comparison.event;

import com.clauselens.domain.comparison.model.ComparisonStatus;

public record ComparisonStatusChangedEvent(String comparisonId, String orgId, ComparisonStatus status) {}
