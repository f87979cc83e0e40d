package com.stylematch.syntax;

/**
 * Kind of a syntax expression node.
 */
public enum ExpressionType {
    /**
     * Node combining sub-expressions (see {@link ExpressionCombinator}).
     */
    COMBINATOR,

    /**
     * Literal keyword, compared case-insensitively.
     */
    KEYWORD,

    /**
     * Data type placeholder such as {@code <length>}.
     */
    DATA
}
