package com.stylematch.value;

/**
 * A style value already resolved by an upstream compiler step.
 * Which payload fields are set depends on {@link #type()}.
 *
 * @param type   Type discriminant
 * @param number Numeric payload (FLOAT, DIMENSION)
 * @param unit   Unit (DIMENSION only)
 * @param text   Text payload (KEYWORD, ENUM, STRING, RESOURCE_PATH, ASSET_REFERENCE)
 * @param color  Color payload (COLOR only)
 */
public record StyleValueHandle(
        StyleValueType type,
        float number,
        DimensionUnit unit,
        String text,
        Color color
) {
    public StyleValueHandle {
        if (type == null) {
            throw new IllegalArgumentException("Style value type cannot be null");
        }
        if (type == StyleValueType.DIMENSION && unit == null) {
            throw new IllegalArgumentException("Dimension value requires a unit");
        }
        if (type == StyleValueType.COLOR && color == null) {
            throw new IllegalArgumentException("Color value requires a color");
        }
    }

    public static StyleValueHandle keyword(String keyword) {
        return new StyleValueHandle(StyleValueType.KEYWORD, 0f, null, keyword, null);
    }

    public static StyleValueHandle number(float value) {
        return new StyleValueHandle(StyleValueType.FLOAT, value, null, null, null);
    }

    public static StyleValueHandle dimension(float value, DimensionUnit unit) {
        return new StyleValueHandle(StyleValueType.DIMENSION, value, unit, null, null);
    }

    public static StyleValueHandle color(Color color) {
        return new StyleValueHandle(StyleValueType.COLOR, 0f, null, null, color);
    }

    public static StyleValueHandle resourcePath(String path) {
        return new StyleValueHandle(StyleValueType.RESOURCE_PATH, 0f, null, path, null);
    }

    public static StyleValueHandle assetReference(String path) {
        return new StyleValueHandle(StyleValueType.ASSET_REFERENCE, 0f, null, path, null);
    }

    public static StyleValueHandle enumValue(String name) {
        return new StyleValueHandle(StyleValueType.ENUM, 0f, null, name, null);
    }

    public static StyleValueHandle string(String value) {
        return new StyleValueHandle(StyleValueType.STRING, 0f, null, value, null);
    }

    public static StyleValueHandle comma() {
        return new StyleValueHandle(StyleValueType.COMMA, 0f, null, ",", null);
    }

    /**
     * Render the value the way it would be written in a stylesheet.
     */
    public String toText() {
        return switch (type) {
            case FLOAT -> formatNumber(number);
            case DIMENSION -> formatNumber(number) + unit.getSuffix();
            case COLOR -> color.toHex();
            case RESOURCE_PATH -> "resource(\"" + text + "\")";
            case ASSET_REFERENCE -> "url(\"" + text + "\")";
            case STRING -> "\"" + text + "\"";
            case KEYWORD, ENUM, COMMA -> text;
        };
    }

    private static String formatNumber(float value) {
        if (value == Math.rint(value) && !Float.isInfinite(value)) {
            return String.valueOf((long) value);
        }
        return String.valueOf(value);
    }

    @Override
    public String toString() {
        return type + "(" + toText() + ")";
    }
}
