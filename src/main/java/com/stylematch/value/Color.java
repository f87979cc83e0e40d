package com.stylematch.value;

/**
 * RGBA color value.
 *
 * @param r Red, 0-255
 * @param g Green, 0-255
 * @param b Blue, 0-255
 * @param a Alpha, 0-1
 */
public record Color(int r, int g, int b, float a) {

    public Color {
        if (r < 0 || r > 255 || g < 0 || g > 255 || b < 0 || b > 255) {
            throw new IllegalArgumentException("Color channel out of range: " + r + ", " + g + ", " + b);
        }
        if (a < 0f || a > 1f) {
            throw new IllegalArgumentException("Alpha out of range: " + a);
        }
    }

    /**
     * Create an opaque color from a packed 0xRRGGBB value.
     */
    public static Color rgb(int packed) {
        return new Color((packed >> 16) & 0xFF, (packed >> 8) & 0xFF, packed & 0xFF, 1f);
    }

    /**
     * Render as {@code #rrggbb}, or {@code rgba(...)} when not opaque.
     */
    public String toHex() {
        if (a < 1f) {
            return "rgba(" + r + ", " + g + ", " + b + ", " + a + ")";
        }
        return String.format("#%02x%02x%02x", r, g, b);
    }
}
