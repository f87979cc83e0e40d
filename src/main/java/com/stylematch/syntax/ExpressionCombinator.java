package com.stylematch.syntax;

/**
 * How the sub-expressions of a combinator node must match.
 */
public enum ExpressionCombinator {
    /**
     * {@code a | b}: exactly one alternative, tried in declaration order.
     */
    OR,

    /**
     * {@code a || b}: one or more alternatives, any order, each at most once.
     */
    OR_OR,

    /**
     * {@code a && b}: every alternative, any order.
     */
    AND_AND,

    /**
     * {@code a b}: every sub-expression, in order.
     */
    JUXTAPOSITION,

    /**
     * {@code [ a ]}: a single sub-expression, used to scope a multiplier.
     */
    GROUP
}
