package com.stylematch.syntax;

import com.stylematch.exception.SyntaxParseException;

import java.util.ArrayList;
import java.util.List;

import static com.stylematch.syntax.SyntaxConfig.*;

/**
 * Tokenizer for property syntax strings.
 * Converts input such as {@code "[ <length> | auto ]{1,4}"} into a sequence of tokens.
 */
public final class SyntaxTokenizer {

    private final String input;
    private final int length;
    private int pos;

    public SyntaxTokenizer(String input) {
        this.input = input;
        this.length = input.length();
        this.pos = 0;
    }

    /**
     * Tokenize the input string.
     *
     * @return List of tokens, terminated by EOF
     */
    public List<SyntaxToken> tokenize() {
        List<SyntaxToken> tokens = new ArrayList<>();

        while (!isAtEnd()) {
            char c = peek();

            if (Character.isWhitespace(c)) {
                advance();
                continue;
            }

            int start = pos;

            switch (c) {
                case Operators.LEFT_BRACKET -> {
                    advance();
                    tokens.add(new SyntaxToken(SyntaxTokenType.LBRACKET, "[", null, start));
                }
                case Operators.RIGHT_BRACKET -> {
                    advance();
                    tokens.add(new SyntaxToken(SyntaxTokenType.RBRACKET, "]", null, start));
                }
                case Operators.COMMA -> {
                    advance();
                    tokens.add(new SyntaxToken(SyntaxTokenType.COMMA, COMMA_KEYWORD, COMMA_KEYWORD, start));
                }
                case Operators.QUESTION -> {
                    advance();
                    tokens.add(new SyntaxToken(SyntaxTokenType.QUESTION, "?", null, start));
                }
                case Operators.ASTERISK -> {
                    advance();
                    tokens.add(new SyntaxToken(SyntaxTokenType.ASTERISK, "*", null, start));
                }
                case Operators.PLUS -> {
                    advance();
                    tokens.add(new SyntaxToken(SyntaxTokenType.PLUS, "+", null, start));
                }
                case Operators.HASH -> {
                    advance();
                    tokens.add(new SyntaxToken(SyntaxTokenType.HASH, "#", null, start));
                }
                case Operators.BAR -> {
                    advance();
                    if (match(Operators.BAR)) {
                        tokens.add(new SyntaxToken(SyntaxTokenType.DOUBLE_BAR, "||", null, start));
                    } else {
                        tokens.add(new SyntaxToken(SyntaxTokenType.BAR, "|", null, start));
                    }
                }
                case Operators.AMPERSAND -> {
                    advance();
                    if (match(Operators.AMPERSAND)) {
                        tokens.add(new SyntaxToken(SyntaxTokenType.DOUBLE_AMPERSAND, "&&", null, start));
                    } else {
                        throw error("Unexpected '&'", start);
                    }
                }
                case Operators.LEFT_ANGLE -> tokens.add(readAngleTerm());
                case Operators.LEFT_BRACE -> tokens.add(readRange());
                default -> {
                    if (isKeywordPart(c)) {
                        tokens.add(readKeyword());
                    } else {
                        throw error("Unexpected character '" + c + "'", start);
                    }
                }
            }
        }

        tokens.add(new SyntaxToken(SyntaxTokenType.EOF, "", null, pos));
        return tokens;
    }

    private SyntaxToken readAngleTerm() {
        int start = pos;
        advance(); // '<'

        boolean propertyRef = match(Operators.QUOTE);
        int nameStart = pos;
        while (!isAtEnd() && isKeywordPart(peek())) {
            advance();
        }
        String name = input.substring(nameStart, pos);
        if (name.isEmpty()) {
            throw error("Expected a name after '<'", start);
        }

        if (propertyRef && !match(Operators.QUOTE)) {
            throw error("Unterminated property reference '" + name + "'", start);
        }
        if (!match(Operators.RIGHT_ANGLE)) {
            throw error("Expected '>' after '" + name + "'", start);
        }

        String text = input.substring(start, pos);
        SyntaxTokenType type = propertyRef ? SyntaxTokenType.PROPERTY_REF : SyntaxTokenType.DATA_TYPE;
        return new SyntaxToken(type, text, name, start);
    }

    private SyntaxToken readRange() {
        int start = pos;
        advance(); // '{'

        int min = readInt(start);
        int max = min;
        if (match(Operators.COMMA)) {
            skipWhitespace();
            max = !isAtEnd() && Character.isDigit(peek()) ? readInt(start) : ExpressionMultiplier.UNBOUNDED;
        }
        if (!match(Operators.RIGHT_BRACE)) {
            throw error("Unterminated range", start);
        }
        if (max < min) {
            throw error("Range maximum " + max + " is lower than minimum " + min, start);
        }

        return new SyntaxToken(SyntaxTokenType.RANGE, input.substring(start, pos), new int[]{min, max}, start);
    }

    private int readInt(int rangeStart) {
        skipWhitespace();
        int start = pos;
        while (!isAtEnd() && Character.isDigit(peek())) {
            advance();
        }
        String text = input.substring(start, pos);
        skipWhitespace();
        if (text.isEmpty()) {
            throw error("Expected a number in range", rangeStart);
        }
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException e) {
            throw error("Invalid number '" + text + "'", start);
        }
    }

    private SyntaxToken readKeyword() {
        int start = pos;
        while (!isAtEnd() && isKeywordPart(peek())) {
            advance();
        }
        String text = input.substring(start, pos);
        return new SyntaxToken(SyntaxTokenType.KEYWORD, text, text, start);
    }

    private boolean isKeywordPart(char c) {
        return Character.isLetterOrDigit(c) || c == Operators.MINUS || c == Operators.UNDERSCORE;
    }

    private void skipWhitespace() {
        while (!isAtEnd() && Character.isWhitespace(peek())) {
            advance();
        }
    }

    private char advance() {
        return input.charAt(pos++);
    }

    private boolean match(char expected) {
        if (isAtEnd() || input.charAt(pos) != expected) {
            return false;
        }
        pos++;
        return true;
    }

    private char peek() {
        return input.charAt(pos);
    }

    private boolean isAtEnd() {
        return pos >= length;
    }

    private SyntaxParseException error(String message, int position) {
        return new SyntaxParseException("Invalid syntax at position "
                + position + ": " + message + " in '" + input + "'", position);
    }
}
