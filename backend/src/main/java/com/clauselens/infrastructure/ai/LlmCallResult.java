package com.clauselens.infrastructure.ai;

/**
 * Reply text of one chat completion with its token usage.
 */
public record LlmCallResult(String content, long promptTokens, long completionTokens) {}
