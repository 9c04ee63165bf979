// file: core/src/main/java/io/compsync/core/model/VisualStyle.java
package io.compsync.core.model;

import java.util.List;

/**
 * Paint-related attributes of a node.
 */
public record VisualStyle(
        List<Paint> fills,
        List<Paint> strokes,
        double strokeWidth,
        double cornerRadius,
        double opacity,
        boolean visible
) {

    public static final double DEFAULT_STROKE_WIDTH = 1.0;

    public static final VisualStyle DEFAULT =
            new VisualStyle(List.of(), List.of(), DEFAULT_STROKE_WIDTH, 0, 1.0, true);

    public VisualStyle {
        fills = fills == null ? List.of() : List.copyOf(fills);
        strokes = strokes == null ? List.of() : List.copyOf(strokes);
    }

    /** Single solid fill, everything else default. */
    public static VisualStyle filled(Color color) {
        return new VisualStyle(List.of(Paint.solid(color)), List.of(), DEFAULT_STROKE_WIDTH, 0, 1.0, true);
    }

    public VisualStyle withFills(List<Paint> newFills) {
        return new VisualStyle(newFills, strokes, strokeWidth, cornerRadius, opacity, visible);
    }

    public VisualStyle withCornerRadius(double radius) {
        return new VisualStyle(fills, strokes, strokeWidth, radius, opacity, visible);
    }
}
