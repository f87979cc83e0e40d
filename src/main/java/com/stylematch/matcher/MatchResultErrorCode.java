package com.stylematch.matcher;

/**
 * Outcome of matching a value against a syntax.
 */
public enum MatchResultErrorCode {
    NONE,
    SYNTAX,
    EMPTY_VALUE,
    EXPECTED_END_OF_VALUE
}
