package com.stylematch.validation;

/**
 * Severity of a validation result.
 */
public enum StyleValidationStatus {
    OK,
    ERROR,
    // Value is usable but carries trailing tokens
    WARNING
}
