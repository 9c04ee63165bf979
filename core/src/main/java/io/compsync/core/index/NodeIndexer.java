// file: core/src/main/java/io/compsync/core/index/NodeIndexer.java
package io.compsync.core.index;

import io.compsync.core.diag.DiagnosticEvent;
import io.compsync.core.diag.OverrideDiagnostics;
import io.compsync.core.model.Document;
import io.compsync.core.model.Node;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds a {@link ReferenceIndex} over a parsed document.
 * <p>
 * Traversal is pre-order (document order), so "first" in every table means
 * first in document order. A repeated identity is reported as DuplicateIdentity
 * and skipped; the build itself never fails on document content.
 */
public final class NodeIndexer {

    private final OverrideDiagnostics diagnostics;

    public NodeIndexer(OverrideDiagnostics diagnostics) {
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    }

    public ReferenceIndex build(Document document) {
        Objects.requireNonNull(document, "document");

        Map<String, Node> byId = new HashMap<>();
        Map<String, List<Node>> byName = new HashMap<>();
        Map<VariantKey, Node> byVariant = new HashMap<>();

        // Explicit stack: library documents can be deep.
        Deque<Node> stack = new ArrayDeque<>();
        stack.push(document.root());
        while (!stack.isEmpty()) {
            Node n = stack.pop();

            if (byId.putIfAbsent(n.id(), n) != null) {
                if (diagnostics.enabled()) {
                    diagnostics.emit(new DiagnosticEvent.DuplicateIdentity(document.id(), n.id()));
                }
            } else {
                if (!n.name().isEmpty()) {
                    byName.computeIfAbsent(n.name(), k -> new ArrayList<>()).add(n);
                }
                if (n.variantGroup() != null && !n.variantGroup().isBlank()) {
                    byVariant.putIfAbsent(new VariantKey(n.name(), n.variantGroup()), n);
                }
            }

            // push in reverse so the first child is visited first
            List<Node> children = n.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }

        Map<String, List<Node>> frozenNames = new HashMap<>(byName.size());
        byName.forEach((k, v) -> frozenNames.put(k, List.copyOf(v)));
        return new ReferenceIndex(document.id(), byId, frozenNames, byVariant);
    }
}
