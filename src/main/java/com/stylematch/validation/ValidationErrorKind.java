package com.stylematch.validation;

/**
 * Why a property value failed validation.
 */
public enum ValidationErrorKind {
    NONE,

    /**
     * No syntax is registered for the property name.
     */
    UNKNOWN_PROPERTY,

    /**
     * The registered syntax itself does not parse.
     */
    INVALID_GRAMMAR,

    /**
     * The value has no tokens.
     */
    EMPTY_VALUE,

    /**
     * The tokens cannot satisfy the syntax.
     */
    SYNTAX,

    /**
     * The syntax was satisfied by a prefix of the tokens.
     */
    EXPECTED_END_OF_VALUE
}
