package com.stylematch.value;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ValueTokenizer.
 */
class ValueTokenizerTest {

    @Test
    @DisplayName("Should split on whitespace")
    void shouldSplitOnWhitespace() {
        assertEquals(List.of("1px", "2px", "auto"), new ValueTokenizer("1px  2px\tauto").tokenize());
    }

    @Test
    @DisplayName("Should return no parts for blank or null input")
    void shouldReturnEmptyForBlank() {
        assertTrue(new ValueTokenizer("").tokenize().isEmpty());
        assertTrue(new ValueTokenizer("   ").tokenize().isEmpty());
        assertTrue(new ValueTokenizer(null).tokenize().isEmpty());
    }

    @Test
    @DisplayName("Should emit top-level commas as separate parts")
    void shouldEmitCommas() {
        assertEquals(List.of("width", ",", "height", ",", "color"),
                new ValueTokenizer("width, height ,color").tokenize());
    }

    @Test
    @DisplayName("Should keep function calls whole")
    void shouldKeepFunctionCallsWhole() {
        assertEquals(List.of("rgb(255, 0, 0)", "2px"), new ValueTokenizer("rgb(255, 0, 0) 2px").tokenize());
        assertEquals(List.of("var(--a, var(--b))"), new ValueTokenizer("var(--a, var(--b))").tokenize());
    }

    @Test
    @DisplayName("Should keep unterminated function call as last part")
    void shouldKeepUnterminatedCall() {
        assertEquals(List.of("1px", "rgb(1, 2"), new ValueTokenizer("1px rgb(1, 2").tokenize());
    }
}
