package com.stylematch.syntax;

/**
 * Occurrence constraint attached to an expression node.
 * Bounds are inclusive on both ends.
 *
 * @param type Repetition kind
 * @param min  Minimum number of occurrences
 * @param max  Maximum number of occurrences ({@link #UNBOUNDED} for no limit)
 */
public record ExpressionMultiplier(MultiplierType type, int min, int max) {

    public static final int UNBOUNDED = Integer.MAX_VALUE;

    public static final ExpressionMultiplier NONE = new ExpressionMultiplier(MultiplierType.NONE, 1, 1);

    public ExpressionMultiplier {
        if (type == null) {
            throw new IllegalArgumentException("Multiplier type cannot be null");
        }
        if (min < 0 || max < min) {
            throw new IllegalArgumentException("Invalid multiplier bounds {" + min + "," + max + "}");
        }
    }

    /**
     * {@code {min,max}}
     */
    public static ExpressionMultiplier range(int min, int max) {
        return new ExpressionMultiplier(MultiplierType.RANGE, min, max);
    }

    /**
     * {@code ?}
     */
    public static ExpressionMultiplier optional() {
        return range(0, 1);
    }

    /**
     * {@code *}
     */
    public static ExpressionMultiplier zeroOrMore() {
        return range(0, UNBOUNDED);
    }

    /**
     * {@code +}
     */
    public static ExpressionMultiplier oneOrMore() {
        return range(1, UNBOUNDED);
    }

    /**
     * {@code #} or {@code #{min,max}}
     */
    public static ExpressionMultiplier commaList(int min, int max) {
        return new ExpressionMultiplier(MultiplierType.COMMA_LIST, min, max);
    }

    public boolean isNone() {
        return type == MultiplierType.NONE;
    }

    @Override
    public String toString() {
        if (type == MultiplierType.NONE) {
            return "";
        }
        String bounds = max == UNBOUNDED ? "{" + min + ",}" : "{" + min + "," + max + "}";
        return type == MultiplierType.COMMA_LIST ? "#" + bounds : bounds;
    }
}
