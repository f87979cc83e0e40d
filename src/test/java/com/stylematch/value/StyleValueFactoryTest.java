package com.stylematch.value;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for StyleValueFactory and the resolved value types.
 */
class StyleValueFactoryTest {

    @Test
    @DisplayName("Should create values of every type from JSON")
    void shouldCreateValuesFromJson() {
        List<StyleValueHandle> values = StyleValueFactory.fromJson("["
                + "{\"type\": \"dimension\", \"value\": 10, \"unit\": \"px\"},"
                + "{\"type\": \"float\", \"value\": 0.5},"
                + "{\"type\": \"keyword\", \"value\": \"auto\"},"
                + "{\"type\": \"color\", \"value\": \"#f0f\"},"
                + "{\"type\": \"enum\", \"value\": \"red\"},"
                + "{\"type\": \"resource-path\", \"value\": \"icons/close\"},"
                + "{\"type\": \"asset_reference\", \"value\": \"project://a.png\"},"
                + "{\"type\": \"comma\"}"
                + "]");

        assertEquals(8, values.size());
        assertEquals(StyleValueType.DIMENSION, values.get(0).type());
        assertEquals(DimensionUnit.PIXEL, values.get(0).unit());
        assertEquals(10f, values.get(0).number());
        assertEquals(StyleValueType.FLOAT, values.get(1).type());
        assertEquals(StyleValueType.KEYWORD, values.get(2).type());
        assertEquals(new Color(255, 0, 255, 1f), values.get(3).color());
        assertEquals(StyleValueType.ENUM, values.get(4).type());
        assertEquals(StyleValueType.RESOURCE_PATH, values.get(5).type());
        assertEquals(StyleValueType.ASSET_REFERENCE, values.get(6).type());
        assertEquals(StyleValueType.COMMA, values.get(7).type());
    }

    @Test
    @DisplayName("Should render values as stylesheet text")
    void shouldRenderText() {
        assertEquals("10px", StyleValueHandle.dimension(10f, DimensionUnit.PIXEL).toText());
        assertEquals("50%", StyleValueHandle.dimension(50f, DimensionUnit.PERCENT).toText());
        assertEquals("1.5", StyleValueHandle.number(1.5f).toText());
        assertEquals("#ff00ff", StyleValueHandle.color(Color.rgb(0xFF00FF)).toText());
        assertEquals("resource(\"icons/close\")", StyleValueHandle.resourcePath("icons/close").toText());
        assertEquals(",", StyleValueHandle.comma().toText());
    }

    @Test
    @DisplayName("Should accept named colors")
    void shouldAcceptNamedColors() {
        List<StyleValueHandle> values = StyleValueFactory.fromJson("[{\"type\": \"color\", \"value\": \"Red\"}]");
        assertEquals(new Color(255, 0, 0, 1f), values.get(0).color());
        assertTrue(NamedColors.tryGetNamedColor("transparent").isPresent());
        assertFalse(NamedColors.tryGetNamedColor("notacolor").isPresent());
    }

    @Test
    @DisplayName("Should return no values for blank payload")
    void shouldReturnEmptyForBlank() {
        assertTrue(StyleValueFactory.fromJson("  ").isEmpty());
    }

    @Test
    @DisplayName("Should reject malformed payloads")
    void shouldRejectMalformedPayloads() {
        assertThrows(IllegalArgumentException.class, () -> StyleValueFactory.fromJson("not json"));
        assertThrows(IllegalArgumentException.class,
                () -> StyleValueFactory.fromJson("[{\"type\": \"gradient\", \"value\": 1}]"));
        assertThrows(IllegalArgumentException.class,
                () -> StyleValueFactory.fromJson("[{\"type\": \"dimension\", \"value\": 1, \"unit\": \"em\"}]"));
        assertThrows(IllegalArgumentException.class,
                () -> StyleValueFactory.fromJson("[{\"type\": \"color\", \"value\": \"#zzzzzz\"}]"));
        assertThrows(IllegalArgumentException.class, () -> StyleValueFactory.fromJson("[{\"value\": 1}]"));
        assertThrows(IllegalArgumentException.class, () -> StyleValueFactory.fromJson("[null]"));
    }
}
