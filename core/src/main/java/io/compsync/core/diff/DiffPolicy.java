// file: core/src/main/java/io/compsync/core/diff/DiffPolicy.java
package io.compsync.core.diff;

/**
 * Noise tolerance of the differ.
 *
 * @param epsilon      max absolute difference for layout and size values
 *                     (document units) that still counts as equal
 * @param colorEpsilon max absolute difference per color channel / opacity
 *                     (range 0..1) that still counts as equal
 */
public record DiffPolicy(double epsilon, double colorEpsilon) {

    public static final double DEFAULT_EPSILON = 0.01;
    public static final double DEFAULT_COLOR_EPSILON = 0.5 / 255.0;

    public static final DiffPolicy DEFAULT = new DiffPolicy(DEFAULT_EPSILON, DEFAULT_COLOR_EPSILON);

    public DiffPolicy {
        if (!(epsilon >= 0) || Double.isInfinite(epsilon)) {
            throw new IllegalArgumentException("epsilon must be a finite value >= 0");
        }
        if (!(colorEpsilon >= 0) || colorEpsilon >= 1) {
            throw new IllegalArgumentException("colorEpsilon must be in [0, 1)");
        }
    }

    public static DiffPolicy withEpsilon(double epsilon) {
        return new DiffPolicy(epsilon, DEFAULT_COLOR_EPSILON);
    }

    boolean near(double a, double b) {
        return a == b || Math.abs(a - b) <= epsilon;
    }

    boolean nearUnit(double a, double b) {
        return a == b || Math.abs(a - b) <= colorEpsilon;
    }
}
