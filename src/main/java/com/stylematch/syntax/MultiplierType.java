package com.stylematch.syntax;

/**
 * Repetition kind of an expression.
 */
public enum MultiplierType {
    // Exactly one occurrence
    NONE,

    // min..max occurrences
    RANGE,

    // min..max occurrences separated by commas ('#')
    COMMA_LIST
}
