package com.stylematch.matcher;

import com.stylematch.syntax.DataType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TextTokenClassifier.
 */
class TextTokenClassifierTest {

    private TextTokenClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new TextTokenClassifier();
    }

    @ParameterizedTest
    @CsvSource({
            "10, NUMBER, true",
            "-1.5, NUMBER, true",
            "10px, NUMBER, false",
            "10, INTEGER, true",
            "1.5, INTEGER, false",
            "10px, LENGTH, true",
            "-2.5px, LENGTH, true",
            "0, LENGTH, true",
            "0.0, LENGTH, true",
            "10, LENGTH, false",
            "10%, LENGTH, false",
            "50%, PERCENTAGE, true",
            "0, PERCENTAGE, true",
            "50px, PERCENTAGE, false",
            "#fff, COLOR, true",
            "#a0b1c2, COLOR, true",
            "#abcd, COLOR, false",
            "red, COLOR, true",
            "notacolor, COLOR, false",
            "resource(icons/close), RESOURCE, true",
            "resource(var(--icon)), RESOURCE, false",
            "url(project://a.png), URL, true",
            "url(project://a.png), RESOURCE, false"
    })
    @DisplayName("Should classify data types by pattern")
    void shouldClassifyDataTypes(String token, DataType dataType, boolean expected) {
        assertEquals(expected, classifier.matchesDataType(token, dataType));
    }

    @Test
    @DisplayName("Should recognize rgb and rgba colors")
    void shouldRecognizeRgbColors() {
        assertTrue(classifier.matchesDataType("rgb(255, 0, 0)", DataType.COLOR));
        assertTrue(classifier.matchesDataType("rgba(255,0,0,0.5)", DataType.COLOR));
        assertFalse(classifier.matchesDataType("rgb(255, 0)", DataType.COLOR));
    }

    @Test
    @DisplayName("Should match keywords case-insensitively")
    void shouldMatchKeywords() {
        assertTrue(classifier.matchesKeyword("AUTO", "auto"));
        assertFalse(classifier.matchesKeyword("autos", "auto"));
        assertFalse(classifier.matchesKeyword(null, "auto"));
    }

    @Test
    @DisplayName("Should detect variables, commas and unconditional tokens")
    void shouldDetectSpecialTokens() {
        assertTrue(classifier.isVariable("var(--accent)"));
        assertFalse(classifier.isVariable("variable"));
        assertTrue(classifier.isComma(","));
        assertFalse(classifier.isComma(";"));
        assertTrue(classifier.isUnconditional("initial"));
        assertTrue(classifier.isUnconditional("env(safe-area-inset-top)"));
        assertTrue(classifier.isUnconditional("INITIAL"));
        assertTrue(classifier.isUnconditional("ENV(safe-area-inset-top)"));
        assertFalse(classifier.isUnconditional("inherit"));
    }
}
