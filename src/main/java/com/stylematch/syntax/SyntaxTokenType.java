package com.stylematch.syntax;

/**
 * Token types for property syntax parsing.
 */
public enum SyntaxTokenType {
    // Terms
    DATA_TYPE,
    PROPERTY_REF,
    KEYWORD,
    COMMA,

    // Combinators
    BAR,
    DOUBLE_BAR,
    DOUBLE_AMPERSAND,

    // Grouping
    LBRACKET,
    RBRACKET,

    // Multipliers
    QUESTION,
    ASTERISK,
    PLUS,
    HASH,
    RANGE,

    // Special
    EOF
}
