package com.stylematch.syntax;

import java.util.Optional;

/**
 * Data types a value token can be classified as.
 * Each type is written {@code <name>} in a property syntax.
 */
public enum DataType {
    NUMBER("number"),
    INTEGER("integer"),
    LENGTH("length"),
    PERCENTAGE("percentage"),
    COLOR("color"),
    RESOURCE("resource"),
    URL("url");

    private final String syntaxName;

    DataType(String syntaxName) {
        this.syntaxName = syntaxName;
    }

    public String getSyntaxName() {
        return syntaxName;
    }

    /**
     * Find the data type written as {@code <name>} in a syntax.
     *
     * @param name Name without angle brackets (e.g., "length")
     * @return The data type, or empty if the name is not a built-in type
     */
    public static Optional<DataType> fromSyntaxName(String name) {
        for (DataType type : values()) {
            if (type.syntaxName.equals(name)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
