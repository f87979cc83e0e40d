package com.stylematch.syntax;

/**
 * Symbols of the property syntax language.
 */
public final class SyntaxConfig {

    private SyntaxConfig() {
    }

    /**
     * Operator symbols.
     */
    public static final class Operators {
        public static final char LEFT_BRACKET = '[';
        public static final char RIGHT_BRACKET = ']';
        public static final char LEFT_ANGLE = '<';
        public static final char RIGHT_ANGLE = '>';
        public static final char LEFT_BRACE = '{';
        public static final char RIGHT_BRACE = '}';
        public static final char BAR = '|';
        public static final char AMPERSAND = '&';
        public static final char COMMA = ',';
        public static final char QUESTION = '?';
        public static final char ASTERISK = '*';
        public static final char PLUS = '+';
        public static final char HASH = '#';
        public static final char QUOTE = '\'';
        public static final char MINUS = '-';
        public static final char UNDERSCORE = '_';

        private Operators() {
        }
    }

    /**
     * Literal text of a comma keyword.
     */
    public static final String COMMA_KEYWORD = ",";
}
