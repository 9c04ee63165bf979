// file: core/src/main/java/io/compsync/core/model/LayoutStyle.java
package io.compsync.core.model;

/**
 * Layout attributes of a node.
 * <p>
 * Position and size are only authored when the corresponding mode says so:
 *  - x / y are authored iff positioning == ABSOLUTE,
 *  - width is authored iff horizontalSizing == FIXED,
 *  - height is authored iff verticalSizing == FIXED.
 * Otherwise the values are whatever the flow layout computed.
 */
public record LayoutStyle(
        Positioning positioning,
        double x,
        double y,
        Sizing horizontalSizing,
        Sizing verticalSizing,
        double width,
        double height,
        LayoutMode layoutMode,
        Insets padding,
        double itemSpacing
) {

    public enum Positioning { ABSOLUTE, AUTO }

    public enum Sizing { FIXED, HUG, FILL }

    /** Auto-layout direction of this node's own children. */
    public enum LayoutMode { NONE, HORIZONTAL, VERTICAL }

    public static final LayoutStyle DEFAULT = new LayoutStyle(
            Positioning.ABSOLUTE, 0, 0, Sizing.FIXED, Sizing.FIXED, 0, 0,
            LayoutMode.NONE, Insets.ZERO, 0
    );

    /** Absolutely positioned, fixed size box. */
    public static LayoutStyle absolute(double x, double y, double width, double height) {
        return new LayoutStyle(Positioning.ABSOLUTE, x, y, Sizing.FIXED, Sizing.FIXED, width, height,
                LayoutMode.NONE, Insets.ZERO, 0);
    }

    /** Box placed and sized by its parent's auto layout; x/y/width/height are computed values. */
    public static LayoutStyle flow(double x, double y, double width, double height) {
        return new LayoutStyle(Positioning.AUTO, x, y, Sizing.HUG, Sizing.HUG, width, height,
                LayoutMode.NONE, Insets.ZERO, 0);
    }

    public LayoutStyle withPosition(double nx, double ny) {
        return new LayoutStyle(positioning, nx, ny, horizontalSizing, verticalSizing, width, height,
                layoutMode, padding, itemSpacing);
    }

    public LayoutStyle withSize(double w, double h) {
        return new LayoutStyle(positioning, x, y, horizontalSizing, verticalSizing, w, h,
                layoutMode, padding, itemSpacing);
    }
}
