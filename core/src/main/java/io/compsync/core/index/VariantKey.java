// file: core/src/main/java/io/compsync/core/index/VariantKey.java
package io.compsync.core.index;

/** Lookup key of a variant: component name inside its variant group. */
public record VariantKey(String name, String variantGroup) {}
