package com.stylematch.config;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Registry of property syntaxes and named definitions.
 * Immutable after construction.
 */
public final class PropertyCatalog implements PropertySyntaxSource {

    private final Map<String, String> properties;
    private final Map<String, String> definitions;

    public PropertyCatalog(Map<String, String> properties, Map<String, String> definitions) {
        this.properties = Collections.unmodifiableMap(new TreeMap<>(properties));
        this.definitions = definitions == null
                ? Map.of()
                : Collections.unmodifiableMap(new TreeMap<>(definitions));
    }

    @Override
    public Optional<String> tryGetSyntax(String propertyName) {
        return Optional.ofNullable(propertyName).map(properties::get);
    }

    @Override
    public Optional<String> tryGetDefinition(String name) {
        return Optional.ofNullable(name).map(definitions::get);
    }

    /**
     * Find the registered property with the smallest edit distance to the given name.
     * A candidate is only suggested when its distance is at most max(2, length / 3).
     * Ties go to the alphabetically first name.
     */
    @Override
    public Optional<String> findClosestPropertyName(String name) {
        if (name == null || name.isEmpty()) {
            return Optional.empty();
        }

        int threshold = Math.max(2, name.length() / 3);
        String closest = null;
        int closestDistance = Integer.MAX_VALUE;
        for (String candidate : properties.keySet()) {
            int distance = editDistance(name, candidate);
            if (distance < closestDistance) {
                closest = candidate;
                closestDistance = distance;
            }
        }
        return closestDistance <= threshold ? Optional.ofNullable(closest) : Optional.empty();
    }

    public Set<String> getPropertyNames() {
        return properties.keySet();
    }

    public Map<String, String> getProperties() {
        return properties;
    }

    public Map<String, String> getDefinitions() {
        return definitions;
    }

    public int size() {
        return properties.size();
    }

    // Levenshtein distance, two-row variant
    private static int editDistance(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }

        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }
}
