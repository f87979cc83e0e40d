package com.stylematch;

import com.stylematch.config.PropertyCatalog;
import com.stylematch.validation.StyleValidationResult;
import com.stylematch.validation.StyleValidationStatus;
import com.stylematch.validation.StyleValidator;
import com.stylematch.validation.ValidationErrorKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests against the bundled property catalog.
 * Tests cover:
 * - Box model shorthands (margin, padding, border-width)
 * - Flex shorthand with property references
 * - Colors, images and comma lists
 * - Unknown property suggestions
 */
@SpringBootTest(args = "width: 10px")
class StyleMatchApplicationTest {

    @Autowired
    private StyleValidator validator;

    @Autowired
    private PropertyCatalog catalog;

    @Test
    @DisplayName("Should load the bundled catalog")
    void shouldLoadBundledCatalog() {
        assertTrue(catalog.tryGetSyntax("flex").isPresent());
        assertTrue(catalog.tryGetDefinition("length-percentage").isPresent());
    }

    @ParameterizedTest
    @CsvSource(delimiter = ';', value = {
            "margin; 1px",
            "margin; 1px auto",
            "margin; 0 10% 2px auto",
            "padding; 4px 8px",
            "border-width; 1px 2px 3px",
            "border-color; red #00ff00 blue",
            "flex; none",
            "flex; 1",
            "flex; 1 0 auto",
            "flex; 20px",
            "flex-basis; 50%",
            "display; flex",
            "opacity; 0.5",
            "color; rgba(255, 0, 0, 0.5)",
            "background-image; resource(icons/close)",
            "background-image; url(project://ui/bg.png)",
            "background-image; none",
            "text-shadow; 2px 2px red",
            "text-shadow; red 2px 2px 4px",
            "-unity-text-outline; 1px",
            "-unity-text-outline; black 1px",
            "-unity-slice-left; 12",
            "-unity-text-align; middle-center",
            "transition-property; width, height, opacity",
            "scale; 1 2",
            "translate; 10px 50%",
            "cursor; resource(cursors/hand) 4 4",
            "cursor; link",
            "width; var(--panel-width)",
            "height; initial"
    })
    @DisplayName("Should accept valid declarations")
    void shouldAcceptValidDeclarations(String name, String value) {
        StyleValidationResult result = validator.validateProperty(name, value);
        assertTrue(result.isSuccess(), () -> name + ": " + value + " -> " + result.message());
    }

    @ParameterizedTest
    @CsvSource(delimiter = ';', value = {
            "width; 10",
            "display; grid",
            "-unity-slice-left; 1.5",
            "flex-grow; 1px",
            "color; notacolor",
            "background-image; resource(var(--icon))",
            "transition-property; width,"
    })
    @DisplayName("Should reject invalid declarations")
    void shouldRejectInvalidDeclarations(String name, String value) {
        assertFalse(validator.validateProperty(name, value).isSuccess());
    }

    @Test
    @DisplayName("Should warn about too many margin values")
    void shouldWarnAboutExtraMarginValues() {
        StyleValidationResult result = validator.validateProperty("margin", "1px 2px 3px 4px 5px");

        assertEquals(StyleValidationStatus.WARNING, result.status());
        assertEquals("5px", result.errorValue());
    }

    @Test
    @DisplayName("Should suggest the intended property for a typo")
    void shouldSuggestPropertyForTypo() {
        StyleValidationResult result = validator.validateProperty("colour", "red");

        assertEquals(ValidationErrorKind.UNKNOWN_PROPERTY, result.errorKind());
        assertEquals("Unknown property 'colour' (did you mean 'color'?)", result.message());
    }
}
