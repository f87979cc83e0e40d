package com.stylematch.syntax;

/**
 * Represents a token in a property syntax.
 *
 * @param type     Token type
 * @param text     Original text
 * @param literal  Parsed value (name for DATA_TYPE/PROPERTY_REF, int[]{min, max} for RANGE)
 * @param position Position in the syntax string
 */
public record SyntaxToken(SyntaxTokenType type, String text, Object literal, int position) {

    @Override
    public String toString() {
        return type + "(" + text + ")";
    }
}
