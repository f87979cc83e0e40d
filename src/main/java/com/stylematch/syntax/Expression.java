package com.stylematch.syntax;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Node of a parsed property syntax.
 * Immutable; a parsed tree can be shared by any number of matchers.
 *
 * @param type           Node kind
 * @param combinator     Combinator, for COMBINATOR nodes only
 * @param subExpressions Children, for COMBINATOR nodes only
 * @param keyword        Literal keyword, for KEYWORD nodes only
 * @param dataType       Data type, for DATA nodes only
 * @param multiplier     Occurrence constraint
 */
public record Expression(
        ExpressionType type,
        ExpressionCombinator combinator,
        List<Expression> subExpressions,
        String keyword,
        DataType dataType,
        ExpressionMultiplier multiplier
) {
    public Expression {
        if (type == null) {
            throw new IllegalArgumentException("Expression type cannot be null");
        }
        if (multiplier == null) {
            multiplier = ExpressionMultiplier.NONE;
        }
        switch (type) {
            case COMBINATOR -> {
                if (combinator == null) {
                    throw new IllegalArgumentException("Combinator expression requires a combinator");
                }
                if (subExpressions == null || subExpressions.isEmpty()) {
                    throw new IllegalArgumentException(combinator + " requires at least one sub-expression");
                }
                if (combinator == ExpressionCombinator.GROUP && subExpressions.size() != 1) {
                    throw new IllegalArgumentException("GROUP requires exactly one sub-expression, got "
                            + subExpressions.size());
                }
                subExpressions = List.copyOf(subExpressions);
            }
            case KEYWORD -> {
                if (keyword == null || keyword.isEmpty()) {
                    throw new IllegalArgumentException("Keyword expression requires a keyword");
                }
                subExpressions = List.of();
            }
            case DATA -> {
                if (dataType == null) {
                    throw new IllegalArgumentException("Data expression requires a data type");
                }
                subExpressions = List.of();
            }
        }
    }

    /**
     * Create a keyword leaf.
     */
    public static Expression keyword(String keyword) {
        return new Expression(ExpressionType.KEYWORD, null, null, keyword, null, ExpressionMultiplier.NONE);
    }

    /**
     * Create a data type leaf.
     */
    public static Expression data(DataType dataType) {
        return new Expression(ExpressionType.DATA, null, null, null, dataType, ExpressionMultiplier.NONE);
    }

    /**
     * Create a combinator node.
     */
    public static Expression combinator(ExpressionCombinator combinator, List<Expression> subExpressions) {
        return new Expression(ExpressionType.COMBINATOR, combinator, subExpressions, null, null,
                ExpressionMultiplier.NONE);
    }

    public static Expression or(Expression... alternatives) {
        return combinator(ExpressionCombinator.OR, List.of(alternatives));
    }

    public static Expression orOr(Expression... alternatives) {
        return combinator(ExpressionCombinator.OR_OR, List.of(alternatives));
    }

    public static Expression andAnd(Expression... alternatives) {
        return combinator(ExpressionCombinator.AND_AND, List.of(alternatives));
    }

    public static Expression juxtaposition(Expression... sequence) {
        return combinator(ExpressionCombinator.JUXTAPOSITION, List.of(sequence));
    }

    /**
     * Wrap an expression in a GROUP node carrying the given multiplier.
     */
    public static Expression group(Expression child, ExpressionMultiplier multiplier) {
        return new Expression(ExpressionType.COMBINATOR, ExpressionCombinator.GROUP, List.of(child), null, null,
                multiplier);
    }

    /**
     * Copy of this node with a different multiplier.
     */
    public Expression withMultiplier(ExpressionMultiplier newMultiplier) {
        return new Expression(type, combinator, subExpressions, keyword, dataType, newMultiplier);
    }

    @Override
    public String toString() {
        String body = switch (type) {
            case KEYWORD -> keyword;
            case DATA -> "<" + dataType.getSyntaxName() + ">";
            case COMBINATOR -> switch (combinator) {
                case GROUP -> "[ " + subExpressions.get(0) + " ]";
                case OR -> join(" | ");
                case OR_OR -> join(" || ");
                case AND_AND -> join(" && ");
                case JUXTAPOSITION -> join(" ");
            };
        };
        return body + multiplier;
    }

    private String join(String separator) {
        return subExpressions.stream().map(Expression::toString).collect(Collectors.joining(separator));
    }
}
