package com.stylematch.value;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Factory for creating resolved value sequences from a JSON payload.
 * <p>
 * The payload is an array of objects, one per value:
 * <pre>
 * [
 *   {"type": "dimension", "value": 10, "unit": "px"},
 *   {"type": "keyword", "value": "auto"},
 *   {"type": "color", "value": "#ff00ff"}
 * ]
 * </pre>
 */
public class StyleValueFactory {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Create resolved values from a JSON array.
     *
     * @param json JSON array of value objects
     * @return Values in payload order
     * @throws IllegalArgumentException if the payload is not valid JSON or a value is malformed
     */
    public static List<StyleValueHandle> fromJson(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }

        List<Map<String, Object>> entries = parseJson(json);
        List<StyleValueHandle> values = new ArrayList<>(entries.size());
        for (int i = 0; i < entries.size(); i++) {
            values.add(createValue(entries.get(i), i));
        }
        return values;
    }

    private static List<Map<String, Object>> parseJson(String json) {
        try {
            return objectMapper.readValue(json, new TypeReference<List<Map<String, Object>>>() {});
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON payload: " + e.getMessage(), e);
        }
    }

    private static StyleValueHandle createValue(Map<String, Object> entry, int index) {
        if (entry == null) {
            throw new IllegalArgumentException("Value " + index + " is null");
        }
        Object typeObj = entry.get("type");
        if (typeObj == null) {
            throw new IllegalArgumentException("Value " + index + " has no type");
        }

        StyleValueType type;
        try {
            type = StyleValueType.valueOf(typeObj.toString().toUpperCase(Locale.ROOT).replace("-", "_"));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Value " + index + " has unknown type '" + typeObj + "'", e);
        }

        Object value = entry.get("value");
        return switch (type) {
            case FLOAT -> StyleValueHandle.number(getFloat(value, index));
            case DIMENSION -> {
                Object unitObj = entry.get("unit");
                DimensionUnit unit = DimensionUnit.fromString(unitObj == null ? null : unitObj.toString())
                        .orElseThrow(() -> new IllegalArgumentException(
                                "Value " + index + " has unknown unit '" + unitObj + "'"));
                yield StyleValueHandle.dimension(getFloat(value, index), unit);
            }
            case COLOR -> StyleValueHandle.color(parseColor(getText(value, index), index));
            case KEYWORD -> StyleValueHandle.keyword(getText(value, index));
            case ENUM -> StyleValueHandle.enumValue(getText(value, index));
            case STRING -> StyleValueHandle.string(getText(value, index));
            case RESOURCE_PATH -> StyleValueHandle.resourcePath(getText(value, index));
            case ASSET_REFERENCE -> StyleValueHandle.assetReference(getText(value, index));
            case COMMA -> StyleValueHandle.comma();
        };
    }

    private static Color parseColor(String text, int index) {
        if (text.startsWith("#")) {
            String hex = text.substring(1);
            if (hex.length() == 3) {
                StringBuilder expanded = new StringBuilder();
                for (char c : hex.toCharArray()) {
                    expanded.append(c).append(c);
                }
                hex = expanded.toString();
            }
            if (hex.length() == 6) {
                try {
                    return Color.rgb(Integer.parseInt(hex, 16));
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Value " + index + " has invalid color '" + text + "'", e);
                }
            }
        }
        return NamedColors.tryGetNamedColor(text)
                .orElseThrow(() -> new IllegalArgumentException("Value " + index + " has invalid color '" + text + "'"));
    }

    private static float getFloat(Object value, int index) {
        if (value instanceof Number number) {
            return number.floatValue();
        }
        if (value != null) {
            try {
                return Float.parseFloat(value.toString());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Value " + index + " is not numeric: '" + value + "'", e);
            }
        }
        throw new IllegalArgumentException("Value " + index + " has no value");
    }

    private static String getText(Object value, int index) {
        if (value == null) {
            throw new IllegalArgumentException("Value " + index + " has no value");
        }
        return value.toString();
    }
}
