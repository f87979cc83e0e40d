package com.stylematch.value;

/**
 * Type discriminant of a resolved style value.
 */
public enum StyleValueType {
    KEYWORD,
    FLOAT,
    DIMENSION,
    COLOR,
    RESOURCE_PATH,
    ASSET_REFERENCE,
    ENUM,
    STRING,
    COMMA
}
