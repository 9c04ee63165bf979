// file: core/src/main/java/io/compsync/core/resolve/ReferenceResolver.java
package io.compsync.core.resolve;

import io.compsync.core.diag.DiagnosticEvent;
import io.compsync.core.diag.OverrideDiagnostics;
import io.compsync.core.index.ReferenceIndex;
import io.compsync.core.model.ComponentRef;
import io.compsync.core.model.Node;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Finds the reference node an instance was created from.
 * <p>
 * Precedence, first hit wins:
 *  1) componentId in the identity table,
 *  2) componentName in the name table, when the name is unique or the
 *     instance has no variant group,
 *  3) (componentName, componentSetName) in the variant table, when the
 *     instance belongs to a variant group and the plain name is ambiguous
 *     or unknown.
 * If step 3 misses but the name had candidates, the first candidate in
 * document order is used.
 * <p>
 * "No match" is a normal outcome: the result is empty and a
 * ResolutionFailed event is emitted. The caller is responsible for passing
 * the index of the document named by the instance's componentRef.
 */
public final class ReferenceResolver {

    private final OverrideDiagnostics diagnostics;

    public ReferenceResolver(OverrideDiagnostics diagnostics) {
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    }

    public Optional<Resolution> resolve(Node instance, ReferenceIndex index) {
        Objects.requireNonNull(instance, "instance");
        Objects.requireNonNull(index, "index");

        ComponentRef ref = instance.componentRef();
        if (ref == null) {
            return failed(instance, index, "not an instance");
        }

        // 1) identity
        Optional<Node> hit = index.byId(ref.componentId());
        if (hit.isPresent()) {
            return succeeded(instance, index, hit.get(), ResolutionStrategy.BY_IDENTITY);
        }

        // 2) plain name
        List<Node> candidates = index.candidatesByName(ref.componentName());
        if (candidates.size() == 1) {
            return succeeded(instance, index, candidates.get(0), ResolutionStrategy.BY_NAME);
        }
        if (candidates.size() > 1 && !ref.hasVariantGroup()) {
            ambiguous(index, ref.componentName(), candidates);
            return succeeded(instance, index, candidates.get(0), ResolutionStrategy.BY_NAME);
        }

        // 3) name within variant group
        if (ref.hasVariantGroup()) {
            hit = index.byVariant(ref.componentName(), ref.componentSetName());
            if (hit.isPresent()) {
                return succeeded(instance, index, hit.get(), ResolutionStrategy.BY_VARIANT);
            }
            if (!candidates.isEmpty()) {
                ambiguous(index, ref.componentName(), candidates);
                return succeeded(instance, index, candidates.get(0), ResolutionStrategy.BY_NAME);
            }
        }

        return failed(instance, index, "no node matches id=" + ref.componentId()
                + " name=" + ref.componentName() + " set=" + ref.componentSetName());
    }

    private Optional<Resolution> succeeded(Node instance, ReferenceIndex index, Node ref, ResolutionStrategy s) {
        if (diagnostics.enabled()) {
            diagnostics.emit(new DiagnosticEvent.ResolutionSucceeded(
                    instance.id(), index.documentId(), ref.id(), s.name()));
        }
        return Optional.of(new Resolution(ref, s));
    }

    private Optional<Resolution> failed(Node instance, ReferenceIndex index, String reason) {
        if (diagnostics.enabled()) {
            diagnostics.emit(new DiagnosticEvent.ResolutionFailed(instance.id(), index.documentId(), reason));
        }
        return Optional.empty();
    }

    private void ambiguous(ReferenceIndex index, String name, List<Node> candidates) {
        if (diagnostics.enabled()) {
            diagnostics.emit(new DiagnosticEvent.AmbiguousName(
                    index.documentId(), name, candidates.size(), candidates.get(0).id()));
        }
    }
}
