// file: core/src/main/java/io/compsync/core/model/TextStyle.java
package io.compsync.core.model;

/**
 * Typography attributes. Used both for a text node's own style and for
 * individual runs of styled text.
 */
public record TextStyle(
        String fontFamily,
        double fontSize,
        int fontWeight,
        Color color,
        double lineHeight,
        double letterSpacing,
        Align align
) {

    public enum Align { LEFT, CENTER, RIGHT, JUSTIFIED }

    public static final TextStyle DEFAULT =
            new TextStyle("Inter", 12, 400, Color.BLACK, 0, 0, Align.LEFT);

    public TextStyle withColor(Color c) {
        return new TextStyle(fontFamily, fontSize, fontWeight, c, lineHeight, letterSpacing, align);
    }

    public TextStyle withFontSize(double size) {
        return new TextStyle(fontFamily, size, fontWeight, color, lineHeight, letterSpacing, align);
    }
}
