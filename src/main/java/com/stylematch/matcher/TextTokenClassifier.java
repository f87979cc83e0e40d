package com.stylematch.matcher;

import com.stylematch.syntax.DataType;
import com.stylematch.value.NamedColors;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies raw textual value parts using pattern recognition.
 */
public class TextTokenClassifier implements TokenClassifier<String> {

    private static final Pattern NUMBER = Pattern.compile("^[+-]?\\d+(?:\\.\\d+)?$");
    private static final Pattern INTEGER = Pattern.compile("^[+-]?\\d+$");
    private static final Pattern ZERO = Pattern.compile("^0(?:\\.0+)?$");
    private static final Pattern LENGTH = Pattern.compile("^[+-]?\\d+(?:\\.\\d+)?px$");
    private static final Pattern PERCENTAGE = Pattern.compile("^[+-]?\\d+(?:\\.\\d+)?%$");
    private static final Pattern HEX_COLOR = Pattern.compile("^#[a-fA-F0-9]{3}(?:[a-fA-F0-9]{3})?$");
    private static final Pattern RGB = Pattern.compile(
            "^rgb\\(\\s*(\\d+)\\s*,\\s*(\\d+)\\s*,\\s*(\\d+)\\s*\\)$");
    private static final Pattern RGBA = Pattern.compile(
            "^rgba\\(\\s*(\\d+)\\s*,\\s*(\\d+)\\s*,\\s*(\\d+)\\s*,\\s*(\\d+(?:\\.\\d+)?|\\.\\d+)\\s*\\)$");
    private static final Pattern VAR_FUNCTION = Pattern.compile("^var\\(.+\\)$");
    private static final Pattern RESOURCE = Pattern.compile("^resource\\((.+)\\)$");
    private static final Pattern URL = Pattern.compile("^url\\((.+)\\)$");

    private static final String VARIABLE_PREFIX = "var(";
    private static final String ENV_PREFIX = "env(";
    private static final String INITIAL = "initial";
    private static final String COMMA = ",";

    @Override
    public boolean matchesDataType(String token, DataType dataType) {
        if (token == null) {
            return false;
        }
        return switch (dataType) {
            case NUMBER -> NUMBER.matcher(token).matches();
            case INTEGER -> INTEGER.matcher(token).matches();
            case LENGTH -> LENGTH.matcher(token).matches() || ZERO.matcher(token).matches();
            case PERCENTAGE -> PERCENTAGE.matcher(token).matches() || ZERO.matcher(token).matches();
            case COLOR -> isColor(token);
            case RESOURCE -> isFunctionWithPath(RESOURCE, token);
            case URL -> isFunctionWithPath(URL, token);
        };
    }

    @Override
    public boolean matchesKeyword(String token, String keyword) {
        return token != null && token.equalsIgnoreCase(keyword);
    }

    @Override
    public boolean isVariable(String token) {
        return token != null && token.startsWith(VARIABLE_PREFIX);
    }

    @Override
    public boolean isComma(String token) {
        return COMMA.equals(token);
    }

    @Override
    public boolean isUnconditional(String token) {
        return token != null
                && (INITIAL.equalsIgnoreCase(token) || token.regionMatches(true, 0, ENV_PREFIX, 0, ENV_PREFIX.length()));
    }

    @Override
    public String describe(String token) {
        return token;
    }

    private boolean isColor(String token) {
        if (HEX_COLOR.matcher(token).matches()) {
            return true;
        }
        if (RGB.matcher(token).matches() || RGBA.matcher(token).matches()) {
            return true;
        }
        return NamedColors.tryGetNamedColor(token).isPresent();
    }

    // resource(path) / url(path), unless the path is itself a var() call
    private boolean isFunctionWithPath(Pattern function, String token) {
        Matcher matcher = function.matcher(token);
        if (!matcher.matches()) {
            return false;
        }
        String path = matcher.group(1).trim();
        return !VAR_FUNCTION.matcher(path).matches();
    }
}
