package com.stylematch.config;

import com.stylematch.exception.ConfigurationException;
import com.stylematch.syntax.StyleSyntaxParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Loads the property catalog from YAML files.
 * <pre>
 * style-properties:
 *   definitions:
 *     length-percentage: "&lt;length&gt; | &lt;percentage&gt;"
 *   properties:
 *     width: "&lt;length-percentage&gt; | auto"
 * </pre>
 */
public class PropertyCatalogLoader {

    private static final Logger log = LoggerFactory.getLogger(PropertyCatalogLoader.class);

    private static final String CLASSPATH_PREFIX = "classpath:";
    private static final String ROOT_KEY = "style-properties";

    /**
     * Load a catalog from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the catalog file
     * @return Loaded catalog
     */
    public static PropertyCatalog load(String path) {
        log.info("Loading property catalog from: {}", path);

        try {
            Resource resource = getResource(path);
            try (InputStream inputStream = resource.getInputStream()) {
                return parseYaml(inputStream);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load property catalog from: " + path, e);
        }
    }

    /**
     * Parse every registered syntax and log the ones that fail.
     * A broken syntax does not prevent startup; validating the property reports it.
     *
     * @return Number of properties whose syntax does not parse
     */
    public static int verify(PropertyCatalog catalog, StyleSyntaxParser parser) {
        int invalid = 0;
        for (Map.Entry<String, String> entry : catalog.getProperties().entrySet()) {
            if (parser.parse(entry.getValue()).isEmpty()) {
                log.warn("Property '{}' has an invalid syntax: {}", entry.getKey(), entry.getValue());
                invalid++;
            }
        }
        return invalid;
    }

    private static Resource getResource(String path) {
        if (path.startsWith(CLASSPATH_PREFIX)) {
            String resourcePath = path.substring(CLASSPATH_PREFIX.length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    @SuppressWarnings("unchecked")
    private static PropertyCatalog parseYaml(InputStream inputStream) {
        Yaml yaml = new Yaml();
        Map<String, Object> root = yaml.load(inputStream);

        if (root == null) {
            throw new ConfigurationException("Property catalog is empty");
        }

        // Catalog section could be at root or under 'style-properties' key
        Map<String, Object> catalogConfig = root.containsKey(ROOT_KEY)
                ? (Map<String, Object>) root.get(ROOT_KEY)
                : root;

        Map<String, String> properties = parseSyntaxMap(catalogConfig, "properties");
        Map<String, String> definitions = parseSyntaxMap(catalogConfig, "definitions");

        if (properties.isEmpty()) {
            throw new ConfigurationException("Property catalog defines no properties");
        }

        log.info("Loaded property catalog with {} properties, {} definitions",
                properties.size(), definitions.size());

        return new PropertyCatalog(properties, definitions);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, String> parseSyntaxMap(Map<String, Object> catalogConfig, String key) {
        Object section = catalogConfig.get(key);
        if (section == null) {
            return Map.of();
        }
        if (!(section instanceof Map)) {
            throw new ConfigurationException("Section '" + key + "' must be a map of name to syntax");
        }

        Map<String, String> result = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : ((Map<String, Object>) section).entrySet()) {
            Object syntax = entry.getValue();
            if (syntax == null || syntax.toString().isBlank()) {
                throw new ConfigurationException("Entry '" + entry.getKey() + "' in '" + key + "' has no syntax");
            }
            result.put(entry.getKey(), syntax.toString());
            log.debug("Registered {} entry '{}': {}", key, entry.getKey(), syntax);
        }
        return result;
    }
}
