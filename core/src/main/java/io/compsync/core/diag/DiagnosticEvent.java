// file: core/src/main/java/io/compsync/core/diag/DiagnosticEvent.java
package io.compsync.core.diag;

import java.util.List;

/**
 * Structured events emitted by the override engine.
 * <p>
 * Events are observational only: emitting or dropping them never changes
 * what the engine computes.
 */
public sealed interface DiagnosticEvent
        permits DiagnosticEvent.ResolutionSucceeded,
                DiagnosticEvent.ResolutionFailed,
                DiagnosticEvent.AmbiguousName,
                DiagnosticEvent.DiffFound,
                DiagnosticEvent.DiffSuppressed,
                DiagnosticEvent.DuplicateIdentity,
                DiagnosticEvent.KeyCollision,
                DiagnosticEvent.UnmatchedDescendant {

    /** An instance was matched to a reference node. {@code strategy} is the lookup that hit. */
    record ResolutionSucceeded(String instanceId, String documentId, String referenceId, String strategy)
            implements DiagnosticEvent {}

    /** UnresolvedReference: nothing matched, the instance subtree contributes no entries. */
    record ResolutionFailed(String instanceId, String documentId, String reason)
            implements DiagnosticEvent {}

    /** A plain name lookup matched several nodes; the first in document order was used. */
    record AmbiguousName(String documentId, String name, int candidates, String chosenId)
            implements DiagnosticEvent {}

    record DiffFound(String key, String nodeId, List<String> styleFields, List<String> contentFields)
            implements DiagnosticEvent {}

    record DiffSuppressed(String key, String nodeId) implements DiagnosticEvent {}

    /** Index build saw the same identity twice; the first occurrence was kept. */
    record DuplicateIdentity(String documentId, String nodeId) implements DiagnosticEvent {}

    /** Two overridden nodes produced the same key; the first occurrence was kept. */
    record KeyCollision(String key, String keptNodeId, String droppedNodeId) implements DiagnosticEvent {}

    /** An instance descendant had no counterpart in the reference subtree. */
    record UnmatchedDescendant(String nodeId, String name, String parentReferenceId)
            implements DiagnosticEvent {}
}
