package com.stylematch.matcher;

import com.stylematch.syntax.DataType;
import com.stylematch.value.DimensionUnit;
import com.stylematch.value.NamedColors;
import com.stylematch.value.StyleValueHandle;
import com.stylematch.value.StyleValueType;

/**
 * Classifies resolved style values by their type discriminant.
 * <p>
 * Variables never reach this representation: an unresolved variable is reported
 * upstream, so {@link #isVariable} is always false.
 */
public class ResolvedTokenClassifier implements TokenClassifier<StyleValueHandle> {

    private static final float ZERO_EPSILON = 1e-5f;
    private static final String INITIAL = "initial";

    @Override
    public boolean matchesDataType(StyleValueHandle token, DataType dataType) {
        if (token == null) {
            return false;
        }
        return switch (dataType) {
            case NUMBER, INTEGER -> token.type() == StyleValueType.FLOAT;
            case LENGTH -> isDimension(token, DimensionUnit.PIXEL) || isZero(token);
            case PERCENTAGE -> isDimension(token, DimensionUnit.PERCENT) || isZero(token);
            case COLOR -> token.type() == StyleValueType.COLOR
                    || (token.type() == StyleValueType.ENUM && NamedColors.tryGetNamedColor(token.text()).isPresent());
            case RESOURCE -> token.type() == StyleValueType.RESOURCE_PATH;
            case URL -> token.type() == StyleValueType.ASSET_REFERENCE;
        };
    }

    @Override
    public boolean matchesKeyword(StyleValueHandle token, String keyword) {
        if (token == null) {
            return false;
        }
        return switch (token.type()) {
            case KEYWORD, ENUM, COMMA -> keyword.equalsIgnoreCase(token.text());
            default -> false;
        };
    }

    @Override
    public boolean isVariable(StyleValueHandle token) {
        return false;
    }

    @Override
    public boolean isComma(StyleValueHandle token) {
        return token != null && token.type() == StyleValueType.COMMA;
    }

    @Override
    public boolean isUnconditional(StyleValueHandle token) {
        return token != null && token.type() == StyleValueType.KEYWORD && INITIAL.equalsIgnoreCase(token.text());
    }

    @Override
    public String describe(StyleValueHandle token) {
        return token == null ? null : token.toText();
    }

    private static boolean isDimension(StyleValueHandle token, DimensionUnit unit) {
        return token.type() == StyleValueType.DIMENSION && token.unit() == unit;
    }

    private static boolean isZero(StyleValueHandle token) {
        return token.type() == StyleValueType.FLOAT && Math.abs(token.number()) < ZERO_EPSILON;
    }
}
