// file: core/src/main/java/io/compsync/core/resolve/Resolution.java
package io.compsync.core.resolve;

import io.compsync.core.model.Node;

/** Resolved reference node plus the strategy that found it. */
public record Resolution(Node reference, ResolutionStrategy strategy) {}
