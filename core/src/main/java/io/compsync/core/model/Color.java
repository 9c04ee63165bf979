// file: core/src/main/java/io/compsync/core/model/Color.java
package io.compsync.core.model;

/**
 * RGBA color with channels in [0, 1].
 */
public record Color(double r, double g, double b, double a) {

    public static final Color BLACK = new Color(0, 0, 0, 1);
    public static final Color TRANSPARENT = new Color(0, 0, 0, 0);

    /** Opaque color from 8-bit channels, e.g. {@code Color.rgb(255, 0, 0)}. */
    public static Color rgb(int r, int g, int b) {
        return new Color(r / 255.0, g / 255.0, b / 255.0, 1.0);
    }

    /** Same color with every channel clamped into [0, 1] and NaN mapped to 0. */
    public Color clamped() {
        return new Color(clamp(r), clamp(g), clamp(b), clamp(a));
    }

    private static double clamp(double v) {
        if (Double.isNaN(v)) return 0;
        return Math.max(0, Math.min(1, v));
    }
}
