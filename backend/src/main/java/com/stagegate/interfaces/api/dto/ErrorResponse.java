package com.stagegate.interfaces.api.dto;

public record ErrorResponse(String code, String message) {}
