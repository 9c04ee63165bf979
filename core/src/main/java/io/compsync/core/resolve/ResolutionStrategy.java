// file: core/src/main/java/io/compsync/core/resolve/ResolutionStrategy.java
package io.compsync.core.resolve;

/** Which lookup matched an instance to its reference node. */
public enum ResolutionStrategy {
    BY_IDENTITY,
    BY_NAME,
    BY_VARIANT
}
