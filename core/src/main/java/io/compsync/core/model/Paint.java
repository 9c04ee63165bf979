// file: core/src/main/java/io/compsync/core/model/Paint.java
package io.compsync.core.model;

/**
 * A single fill or stroke layer.
 * Only solid paints carry a color; gradient and image paints are compared
 * by type, color stop 0 and opacity.
 */
public record Paint(Type type, Color color, double opacity, boolean visible) {

    public enum Type { SOLID, GRADIENT, IMAGE }

    public static Paint solid(Color color) {
        return new Paint(Type.SOLID, color, 1.0, true);
    }

    /** True when this layer contributes nothing to the render. */
    public boolean invisible() {
        return !visible || opacity <= 0 || (color != null && color.a() <= 0 && type == Type.SOLID);
    }
}
