package com.authplatform.authsvc.shared.validation;

/**
 * Represents a field-level validation error.
 */
public record FieldError(String field, String code, String message) {

    public static FieldError of(String field, String code, String message) {
        return new FieldError(field, code, message);
    }

    public static FieldError required(String field) {
        return new FieldError(field, "REQUIRED", capitalize(field) + " is required");
    }

    private static String capitalize(String field) {
        return field.isEmpty() ? field : Character.toUpperCase(field.charAt(0)) + field.substring(1);
    }
}
