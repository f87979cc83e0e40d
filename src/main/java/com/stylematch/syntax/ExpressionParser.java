package com.stylematch.syntax;

import com.stylematch.config.PropertySyntaxSource;
import com.stylematch.exception.SyntaxParseException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Parser for property syntax strings.
 * Converts tokens into an {@link Expression} tree using recursive descent parsing.
 * <p>
 * Grammar (precedence: juxtaposition > && > || > |):
 * <pre>
 * expression    := or
 * or            := oror ('|' oror)*
 * oror          := andand ('||' andand)*
 * andand        := juxtaposition ('&&' juxtaposition)*
 * juxtaposition := term term*
 * term          := primary multiplier?
 * primary       := '[' expression ']' | data-type | property-ref | keyword | ','
 * multiplier    := '?' | '*' | '+' | range | '#' range?
 * </pre>
 * Named non-terminals ({@code <length-percentage>}) and property references
 * ({@code <'width'>}) are expanded through the {@link PropertySyntaxSource}
 * and become GROUP nodes. Any node carrying a multiplier is a GROUP.
 */
public final class ExpressionParser {

    private final String input;
    private final List<SyntaxToken> tokens;
    private final PropertySyntaxSource syntaxSource;
    private final Set<String> expanding;
    private int index;

    public ExpressionParser(String input, List<SyntaxToken> tokens, PropertySyntaxSource syntaxSource) {
        this(input, tokens, syntaxSource, new HashSet<>());
    }

    private ExpressionParser(String input, List<SyntaxToken> tokens, PropertySyntaxSource syntaxSource,
                             Set<String> expanding) {
        this.input = input;
        this.tokens = tokens;
        this.syntaxSource = syntaxSource;
        this.expanding = expanding;
        this.index = 0;
    }

    /**
     * Parse the token stream into an expression tree.
     *
     * @return Root expression
     */
    public Expression parse() {
        Expression result = parseExpression();
        expect(SyntaxTokenType.EOF);
        return result;
    }

    private Expression parseExpression() {
        return parseOr();
    }

    private Expression parseOr() {
        List<Expression> alternatives = new ArrayList<>();
        alternatives.add(parseOrOr());

        while (match(SyntaxTokenType.BAR)) {
            alternatives.add(parseOrOr());
        }

        return collapse(ExpressionCombinator.OR, alternatives);
    }

    private Expression parseOrOr() {
        List<Expression> alternatives = new ArrayList<>();
        alternatives.add(parseAndAnd());

        while (match(SyntaxTokenType.DOUBLE_BAR)) {
            alternatives.add(parseAndAnd());
        }

        return collapse(ExpressionCombinator.OR_OR, alternatives);
    }

    private Expression parseAndAnd() {
        List<Expression> alternatives = new ArrayList<>();
        alternatives.add(parseJuxtaposition());

        while (match(SyntaxTokenType.DOUBLE_AMPERSAND)) {
            alternatives.add(parseJuxtaposition());
        }

        return collapse(ExpressionCombinator.AND_AND, alternatives);
    }

    private Expression parseJuxtaposition() {
        List<Expression> sequence = new ArrayList<>();
        sequence.add(parseTerm());

        while (isTermStart()) {
            sequence.add(parseTerm());
        }

        return collapse(ExpressionCombinator.JUXTAPOSITION, sequence);
    }

    private Expression parseTerm() {
        Expression primary = parsePrimary();

        Optional<ExpressionMultiplier> multiplier = parseMultiplier();
        if (multiplier.isEmpty()) {
            return primary;
        }
        if (isMultiplierStart()) {
            throw error("Unexpected multiplier '" + peek().text() + "'");
        }
        if (primary.combinator() == ExpressionCombinator.GROUP && primary.multiplier().isNone()) {
            return primary.withMultiplier(multiplier.get());
        }
        return Expression.group(primary, multiplier.get());
    }

    private Expression parsePrimary() {
        if (match(SyntaxTokenType.LBRACKET)) {
            Expression inner = parseExpression();
            expect(SyntaxTokenType.RBRACKET);
            return Expression.group(inner, ExpressionMultiplier.NONE);
        }

        if (match(SyntaxTokenType.KEYWORD, SyntaxTokenType.COMMA)) {
            return Expression.keyword((String) previous().literal());
        }

        if (match(SyntaxTokenType.DATA_TYPE)) {
            String name = (String) previous().literal();
            Optional<DataType> dataType = DataType.fromSyntaxName(name);
            if (dataType.isPresent()) {
                return Expression.data(dataType.get());
            }
            String definition = syntaxSource.tryGetDefinition(name)
                    .orElseThrow(() -> error("Unknown data type '<" + name + ">'"));
            return expand("<" + name + ">", definition);
        }

        if (match(SyntaxTokenType.PROPERTY_REF)) {
            String name = (String) previous().literal();
            String syntax = syntaxSource.tryGetSyntax(name)
                    .orElseThrow(() -> error("Unknown property reference '<'" + name + "'>'"));
            return expand("<'" + name + "'>", syntax);
        }

        throw error("Expected a term");
    }

    private Expression expand(String reference, String syntax) {
        if (!expanding.add(reference)) {
            throw error("Recursive reference " + reference);
        }
        try {
            List<SyntaxToken> nested = new SyntaxTokenizer(syntax).tokenize();
            Expression expanded = new ExpressionParser(syntax, nested, syntaxSource, expanding).parse();
            return Expression.group(expanded, ExpressionMultiplier.NONE);
        } finally {
            expanding.remove(reference);
        }
    }

    private Optional<ExpressionMultiplier> parseMultiplier() {
        if (match(SyntaxTokenType.QUESTION)) {
            return Optional.of(ExpressionMultiplier.optional());
        }
        if (match(SyntaxTokenType.ASTERISK)) {
            return Optional.of(ExpressionMultiplier.zeroOrMore());
        }
        if (match(SyntaxTokenType.PLUS)) {
            return Optional.of(ExpressionMultiplier.oneOrMore());
        }
        if (match(SyntaxTokenType.RANGE)) {
            int[] bounds = (int[]) previous().literal();
            return Optional.of(ExpressionMultiplier.range(bounds[0], bounds[1]));
        }
        if (match(SyntaxTokenType.HASH)) {
            if (match(SyntaxTokenType.RANGE)) {
                int[] bounds = (int[]) previous().literal();
                return Optional.of(ExpressionMultiplier.commaList(bounds[0], bounds[1]));
            }
            return Optional.of(ExpressionMultiplier.commaList(1, ExpressionMultiplier.UNBOUNDED));
        }
        return Optional.empty();
    }

    private static Expression collapse(ExpressionCombinator combinator, List<Expression> subExpressions) {
        return subExpressions.size() == 1
                ? subExpressions.get(0)
                : Expression.combinator(combinator, subExpressions);
    }

    private boolean isTermStart() {
        return check(SyntaxTokenType.LBRACKET)
                || check(SyntaxTokenType.KEYWORD)
                || check(SyntaxTokenType.COMMA)
                || check(SyntaxTokenType.DATA_TYPE)
                || check(SyntaxTokenType.PROPERTY_REF);
    }

    private boolean isMultiplierStart() {
        return check(SyntaxTokenType.QUESTION)
                || check(SyntaxTokenType.ASTERISK)
                || check(SyntaxTokenType.PLUS)
                || check(SyntaxTokenType.RANGE)
                || check(SyntaxTokenType.HASH);
    }

    private boolean match(SyntaxTokenType... types) {
        for (SyntaxTokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private void expect(SyntaxTokenType type) {
        if (!check(type)) {
            throw error("Expected " + type + " but found '" + peek().text() + "'");
        }
        advance();
    }

    private boolean check(SyntaxTokenType type) {
        return peek().type() == type;
    }

    private SyntaxToken advance() {
        if (!isAtEnd()) {
            index++;
        }
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == SyntaxTokenType.EOF;
    }

    private SyntaxToken peek() {
        return tokens.get(index);
    }

    private SyntaxToken previous() {
        return tokens.get(index - 1);
    }

    private SyntaxParseException error(String message) {
        int position = peek().position();
        return new SyntaxParseException("Invalid syntax at position "
                + position + ": " + message + " in '" + input + "'", position);
    }
}
