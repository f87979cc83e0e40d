package com.stylematch.validation;

import java.util.Optional;

/**
 * Outcome of validating one property value.
 *
 * @param status     OK, ERROR or WARNING
 * @param errorKind  NONE when status is OK
 * @param message    Human-readable description, empty when OK
 * @param errorValue Text of the offending token, or null
 * @param hint       Suggestion for fixing the value, or null
 */
public record StyleValidationResult(
        StyleValidationStatus status,
        ValidationErrorKind errorKind,
        String message,
        String errorValue,
        String hint
) {
    private static final StyleValidationResult OK =
            new StyleValidationResult(StyleValidationStatus.OK, ValidationErrorKind.NONE, "", null, null);

    public static StyleValidationResult ok() {
        return OK;
    }

    public static StyleValidationResult error(ValidationErrorKind kind, String message) {
        return new StyleValidationResult(StyleValidationStatus.ERROR, kind, message, null, null);
    }

    public static StyleValidationResult error(ValidationErrorKind kind, String message, String errorValue,
                                              String hint) {
        return new StyleValidationResult(StyleValidationStatus.ERROR, kind, message, errorValue, hint);
    }

    public static StyleValidationResult warning(ValidationErrorKind kind, String message, String errorValue) {
        return new StyleValidationResult(StyleValidationStatus.WARNING, kind, message, errorValue, null);
    }

    public boolean isSuccess() {
        return status == StyleValidationStatus.OK;
    }

    public Optional<String> offendingTokenText() {
        return Optional.ofNullable(errorValue);
    }

    public Optional<String> hintText() {
        return Optional.ofNullable(hint);
    }
}
