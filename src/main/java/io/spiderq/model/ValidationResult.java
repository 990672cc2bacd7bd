package io.spiderq.model;

import com.fasterxml.jackson.databind.JsonNode;

public record ValidationResult(
        boolean valid,
        String message,
        JsonNode userInfo
) {
    public static ValidationResult invalid(String message) {
        return new ValidationResult(false, message == null || message.isBlank() ? "Validation failed" : message, null);
    }
}
