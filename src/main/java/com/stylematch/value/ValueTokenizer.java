package com.stylematch.value;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a raw property value into its parts.
 * <p>
 * Whitespace separates parts, a top-level comma becomes its own {@code ","} part,
 * and a function call such as {@code rgb(255, 0, 0)} is kept whole, including
 * nested parentheses. Unbalanced parentheses are not rejected: the unterminated
 * call simply becomes the last part.
 */
public final class ValueTokenizer {

    private static final char LEFT_PAREN = '(';
    private static final char RIGHT_PAREN = ')';
    private static final char COMMA = ',';

    private final String input;
    private final int length;
    private int pos;

    public ValueTokenizer(String input) {
        this.input = input == null ? "" : input;
        this.length = this.input.length();
        this.pos = 0;
    }

    /**
     * Tokenize the input string.
     *
     * @return Parts in order of appearance; empty for blank input
     */
    public List<String> tokenize() {
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int depth = 0;

        while (!isAtEnd()) {
            char c = advance();

            if (depth > 0) {
                current.append(c);
                if (c == LEFT_PAREN) {
                    depth++;
                } else if (c == RIGHT_PAREN) {
                    depth--;
                }
                continue;
            }

            if (Character.isWhitespace(c)) {
                flush(current, parts);
            } else if (c == COMMA) {
                flush(current, parts);
                parts.add(String.valueOf(COMMA));
            } else {
                current.append(c);
                if (c == LEFT_PAREN) {
                    depth++;
                }
            }
        }

        flush(current, parts);
        return parts;
    }

    private static void flush(StringBuilder current, List<String> parts) {
        if (current.length() > 0) {
            parts.add(current.toString());
            current.setLength(0);
        }
    }

    private char advance() {
        return input.charAt(pos++);
    }

    private boolean isAtEnd() {
        return pos >= length;
    }
}
