package com.authplatform.authsvc.shared.validation;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Input-shape checks run by the engine before any storage access.
 * Only presence and format are checked here; credential correctness is the engine's job.
 */
@Component
public class ValidationService {

    private static final Pattern EMAIL_PATTERN = Pattern.compile(
            "^[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}$"
    );

    public static final int DISPLAY_NAME_MAX_LENGTH = 100;
    public static final int IMAGE_URL_MAX_LENGTH = 2048;

    /**
     * Fails when any of the named values is null or blank. Arguments are (field, value) pairs.
     */
    public void requireAll(String... fieldsAndValues) {
        if (fieldsAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected (field, value) pairs");
        }
        List<FieldError> errors = new ArrayList<>();
        for (int i = 0; i < fieldsAndValues.length; i += 2) {
            if (isBlank(fieldsAndValues[i + 1])) {
                errors.add(FieldError.required(fieldsAndValues[i]));
            }
        }
        if (!errors.isEmpty()) {
            ValidationResult.failure(errors).throwIfInvalid();
        }
    }

    /**
     * Validates a registration request: email present and well-formed, password present,
     * display name within limits when given.
     */
    public ValidationResult validateRegistration(String email, String password, String displayName) {
        List<FieldError> errors = new ArrayList<>();

        if (isBlank(email)) {
            errors.add(FieldError.required("email"));
        } else if (!EMAIL_PATTERN.matcher(normalizeEmail(email)).matches()) {
            errors.add(FieldError.of("email", "INVALID_FORMAT", "Invalid email format"));
        }

        if (password == null || password.isEmpty()) {
            errors.add(FieldError.required("password"));
        }

        if (displayName != null && displayName.trim().length() > DISPLAY_NAME_MAX_LENGTH) {
            errors.add(FieldError.of("name", "TOO_LONG",
                    "Name must not exceed " + DISPLAY_NAME_MAX_LENGTH + " characters"));
        }

        return errors.isEmpty() ? ValidationResult.success() : ValidationResult.failure(errors);
    }

    /**
     * Normalizes email to trimmed lowercase.
     */
    public String normalizeEmail(String email) {
        if (email == null) return null;
        return email.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Trimmed display name as the user typed it, cut to the stored length without splitting a
     * surrogate pair. Blank names become null. Escaping is left to whatever renders it.
     */
    public String normalizeDisplayName(String displayName) {
        if (isBlank(displayName)) return null;
        String trimmed = displayName.trim();
        if (trimmed.length() <= DISPLAY_NAME_MAX_LENGTH) {
            return trimmed;
        }
        int end = DISPLAY_NAME_MAX_LENGTH;
        if (Character.isHighSurrogate(trimmed.charAt(end - 1))) {
            end--;
        }
        return trimmed.substring(0, end).trim();
    }

    /**
     * Avatar URL from an identity provider, or null when blank or too long to store.
     */
    public String normalizeImageUrl(String imageUrl) {
        if (isBlank(imageUrl)) return null;
        String trimmed = imageUrl.trim();
        return trimmed.length() <= IMAGE_URL_MAX_LENGTH ? trimmed : null;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
