package com.stylematch.config;

import java.util.Optional;

/**
 * Source of property syntax strings.
 */
public interface PropertySyntaxSource {

    /**
     * Look up the syntax registered for a property.
     *
     * @param propertyName Property name (e.g., "border-width")
     * @return Syntax string (e.g., "<length>{1,4}"), or empty if the property is unknown
     */
    Optional<String> tryGetSyntax(String propertyName);

    /**
     * Look up a named non-terminal used as {@code <name>} inside syntax strings.
     *
     * @param name Definition name (e.g., "length-percentage")
     * @return Syntax string of the definition, or empty if not defined
     */
    Optional<String> tryGetDefinition(String name);

    /**
     * Find the registered property whose name is closest to the given one.
     *
     * @param name Unknown property name
     * @return A plausibly-similar registered name, or empty if none is close enough
     */
    Optional<String> findClosestPropertyName(String name);
}
