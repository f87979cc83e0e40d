package com.stylematch.validation;

import com.stylematch.value.StyleValueHandle;

import java.util.List;

/**
 * Validates property values against their registered syntax.
 */
public interface StyleValidator {

    /**
     * Validate a raw property value.
     *
     * @param name  Property name (e.g., "border-width")
     * @param value Raw value text (e.g., "1px 2px")
     * @return Validation result
     */
    StyleValidationResult validateProperty(String name, String value);

    /**
     * Validate a property value that was already resolved to typed values.
     *
     * @param name   Property name
     * @param values Resolved values in declaration order
     * @return Validation result
     */
    StyleValidationResult validateProperty(String name, List<StyleValueHandle> values);
}
