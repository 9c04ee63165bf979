// file: core/src/main/java/io/compsync/core/model/Insets.java
package io.compsync.core.model;

public record Insets(double top, double right, double bottom, double left) {
    public static final Insets ZERO = new Insets(0, 0, 0, 0);
}
