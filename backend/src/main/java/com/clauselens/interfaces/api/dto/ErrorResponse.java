package com.clauselens.interfaces.api.dto;

public record ErrorResponse(String code, String message) {}
