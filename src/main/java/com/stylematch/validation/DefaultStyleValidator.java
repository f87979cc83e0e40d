package com.stylematch.validation;

import com.stylematch.config.PropertySyntaxSource;
import com.stylematch.matcher.MatchResult;
import com.stylematch.matcher.ResolvedTokenClassifier;
import com.stylematch.matcher.StyleMatcher;
import com.stylematch.matcher.TextTokenClassifier;
import com.stylematch.syntax.DataType;
import com.stylematch.syntax.Expression;
import com.stylematch.syntax.StyleSyntaxParser;
import com.stylematch.value.StyleValueHandle;
import com.stylematch.value.ValueTokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Default implementation of StyleValidator.
 * Looks up the property syntax, parses it (cached), matches the value and turns
 * the match result into a diagnostic.
 */
public class DefaultStyleValidator implements StyleValidator {

    private static final Logger log = LoggerFactory.getLogger(DefaultStyleValidator.class);

    public static final String CUSTOM_PROPERTY_PREFIX = "--";

    static final String MISSING_UNIT_HINT = "Property expects a unit. Did you forget to add px or %?";

    private static final String LENGTH_PLACEHOLDER = "<length>";
    private static final String PERCENTAGE_PLACEHOLDER = "<percentage>";
    private static final String COLOR_PLACEHOLDER = "<color>";

    private final PropertySyntaxSource syntaxSource;
    private final StyleSyntaxParser syntaxParser;
    private final StyleMatcher<String> textMatcher;
    private final StyleMatcher<StyleValueHandle> resolvedMatcher;

    public DefaultStyleValidator(PropertySyntaxSource syntaxSource) {
        this(syntaxSource, new StyleSyntaxParser(syntaxSource));
    }

    public DefaultStyleValidator(PropertySyntaxSource syntaxSource, StyleSyntaxParser syntaxParser) {
        this.syntaxSource = syntaxSource;
        this.syntaxParser = syntaxParser;
        this.textMatcher = new StyleMatcher<>(new TextTokenClassifier());
        this.resolvedMatcher = new StyleMatcher<>(new ResolvedTokenClassifier());
    }

    @Override
    public StyleValidationResult validateProperty(String name, String value) {
        List<String> tokens = new ValueTokenizer(value).tokenize();
        return validate(name, tokens, textMatcher);
    }

    @Override
    public StyleValidationResult validateProperty(String name, List<StyleValueHandle> values) {
        return validate(name, values == null ? List.of() : values, resolvedMatcher);
    }

    private <T> StyleValidationResult validate(String name, List<T> tokens, StyleMatcher<T> matcher) {
        if (name == null || name.isEmpty()) {
            return StyleValidationResult.error(ValidationErrorKind.UNKNOWN_PROPERTY, "Missing property name");
        }

        // Custom properties have no syntax
        if (name.startsWith(CUSTOM_PROPERTY_PREFIX)) {
            return StyleValidationResult.ok();
        }

        Optional<String> syntax = syntaxSource.tryGetSyntax(name);
        if (syntax.isEmpty()) {
            String message = "Unknown property '" + name + "'";
            Optional<String> closest = syntaxSource.findClosestPropertyName(name);
            if (closest.isPresent()) {
                message = message + " (did you mean '" + closest.get() + "'?)";
            }
            log.debug("{}", message);
            return StyleValidationResult.error(ValidationErrorKind.UNKNOWN_PROPERTY, message);
        }

        Optional<Expression> syntaxTree = syntaxParser.parse(syntax.get());
        if (syntaxTree.isEmpty()) {
            log.warn("Property '{}' has an invalid syntax '{}'", name, syntax.get());
            return StyleValidationResult.error(ValidationErrorKind.INVALID_GRAMMAR,
                    "Invalid '" + name + "' property syntax '" + syntax.get() + "'");
        }

        MatchResult<T> matchResult = matcher.match(syntaxTree.get(), tokens);
        String errorValue = matchResult.offendingToken()
                .map(token -> matcher.getClassifier().describe(token))
                .orElse(null);

        return switch (matchResult.errorCode()) {
            case NONE -> StyleValidationResult.ok();
            case EMPTY_VALUE -> StyleValidationResult.error(ValidationErrorKind.EMPTY_VALUE,
                    "Expected (" + syntax.get() + ") but found empty value");
            case SYNTAX -> StyleValidationResult.error(ValidationErrorKind.SYNTAX,
                    "Expected (" + syntax.get() + ") but found " + quoteOrEnd(errorValue),
                    errorValue,
                    computeHint(syntax.get(), matchResult, matcher, errorValue));
            case EXPECTED_END_OF_VALUE -> StyleValidationResult.warning(ValidationErrorKind.EXPECTED_END_OF_VALUE,
                    "Expected end of value but found '" + errorValue + "'", errorValue);
        };
    }

    private <T> String computeHint(String syntax, MatchResult<T> matchResult, StyleMatcher<T> matcher,
                                   String errorValue) {
        if (isUnitMissing(syntax, matchResult, matcher)) {
            return MISSING_UNIT_HINT;
        }
        if (isUnsupportedColor(syntax) && errorValue != null) {
            return "Unsupported color '" + errorValue + "'.";
        }
        return null;
    }

    // Textual check against the syntax, not a structural query on the tree
    private static <T> boolean isUnitMissing(String syntax, MatchResult<T> matchResult, StyleMatcher<T> matcher) {
        return matchResult.offendingToken()
                .map(token -> matcher.getClassifier().matchesDataType(token, DataType.NUMBER))
                .orElse(false)
                && (syntax.contains(LENGTH_PLACEHOLDER) || syntax.contains(PERCENTAGE_PLACEHOLDER));
    }

    private static boolean isUnsupportedColor(String syntax) {
        return syntax.startsWith(COLOR_PLACEHOLDER);
    }

    private static String quoteOrEnd(String errorValue) {
        return errorValue == null ? "end of value" : "'" + errorValue + "'";
    }
}
