package com.stylematch.adapter.spring;

import com.stylematch.config.PropertyCatalog;
import com.stylematch.config.PropertyCatalogLoader;
import com.stylematch.syntax.StyleSyntaxParser;
import com.stylematch.validation.DefaultStyleValidator;
import com.stylematch.validation.StyleValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot auto-configuration for style validation.
 */
@Configuration
@ConditionalOnProperty(prefix = "style-match", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(StyleValidationProperties.class)
public class StyleValidationAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(StyleValidationAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public PropertyCatalog propertyCatalog(StyleValidationProperties properties) {
        return PropertyCatalogLoader.load(properties.getCatalogPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public StyleSyntaxParser styleSyntaxParser(PropertyCatalog catalog) {
        StyleSyntaxParser parser = new StyleSyntaxParser(catalog);
        int invalid = PropertyCatalogLoader.verify(catalog, parser);
        if (invalid > 0) {
            log.warn("{} of {} property syntaxes failed to parse", invalid, catalog.size());
        }
        return parser;
    }

    @Bean
    @ConditionalOnMissingBean
    public StyleValidator styleValidator(PropertyCatalog catalog, StyleSyntaxParser parser) {
        log.info("Creating StyleValidator for {} properties", catalog.size());
        return new DefaultStyleValidator(catalog, parser);
    }
}
