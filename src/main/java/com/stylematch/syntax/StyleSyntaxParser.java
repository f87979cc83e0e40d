package com.stylematch.syntax;

import com.stylematch.config.PropertySyntaxSource;
import com.stylematch.exception.SyntaxParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Facade for parsing property syntax strings into {@link Expression} trees.
 * <p>
 * Supports:
 * <ul>
 *   <li>Data types: {@code <number> <integer> <length> <percentage> <color> <resource> <url>}</li>
 *   <li>Named definitions {@code <name>} and property references {@code <'name'>}</li>
 *   <li>Combinators: juxtaposition, {@code &&}, {@code ||}, {@code |}</li>
 *   <li>Brackets for grouping</li>
 *   <li>Multipliers: {@code ? * + {n} {n,} {n,m} # #{n,m}}</li>
 * </ul>
 * Parsed trees are immutable and cached per syntax string.
 */
public class StyleSyntaxParser {

    private static final Logger log = LoggerFactory.getLogger(StyleSyntaxParser.class);

    private final PropertySyntaxSource syntaxSource;
    private final Map<String, Optional<Expression>> cache = new ConcurrentHashMap<>();

    public StyleSyntaxParser(PropertySyntaxSource syntaxSource) {
        this.syntaxSource = syntaxSource;
    }

    /**
     * Parse a syntax string.
     *
     * @param syntax Syntax string (e.g., "<length> | <percentage> | auto")
     * @return Expression tree, or empty if the syntax is malformed
     */
    public Optional<Expression> parse(String syntax) {
        if (syntax == null || syntax.isBlank()) {
            return Optional.empty();
        }
        return cache.computeIfAbsent(syntax, this::parseUncached);
    }

    /**
     * Parse a syntax string, failing on malformed input.
     *
     * @param syntax Syntax string
     * @return Expression tree
     * @throws SyntaxParseException if the syntax is malformed
     */
    public Expression parseOrThrow(String syntax) {
        List<SyntaxToken> tokens = new SyntaxTokenizer(syntax).tokenize();
        return new ExpressionParser(syntax, tokens, syntaxSource).parse();
    }

    private Optional<Expression> parseUncached(String syntax) {
        try {
            Expression expression = parseOrThrow(syntax);
            log.debug("Parsed syntax '{}' -> {}", syntax, expression);
            return Optional.of(expression);
        } catch (SyntaxParseException e) {
            log.debug("Rejected syntax '{}': {}", syntax, e.getMessage());
            return Optional.empty();
        }
    }
}
