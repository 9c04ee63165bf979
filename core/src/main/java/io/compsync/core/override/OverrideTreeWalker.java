// file: core/src/main/java/io/compsync/core/override/OverrideTreeWalker.java
package io.compsync.core.override;

import io.compsync.core.diag.DiagnosticEvent;
import io.compsync.core.diag.OverrideDiagnostics;
import io.compsync.core.diff.AttributeDiffer;
import io.compsync.core.diff.ContentDelta;
import io.compsync.core.diff.DiffPolicy;
import io.compsync.core.diff.StyleDelta;
import io.compsync.core.diff.StyleScope;
import io.compsync.core.index.ReferenceIndex;
import io.compsync.core.model.ComponentRef;
import io.compsync.core.model.Node;
import io.compsync.core.resolve.IndexCatalog;
import io.compsync.core.resolve.ReferenceResolver;
import io.compsync.core.resolve.Resolution;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Computes the {@link OverrideMap} of one instance against its reference component.
 * <p>
 * Algorithm:
 *  1) Resolve the root instance in the given index. No match: empty map.
 *  2) Diff the root; key = component set name if any, else the instance name.
 *  3) Walk instance and reference children in lockstep ({@link ChildMatcher}).
 *  4) A descendant that is itself an instance is NOT compared with the
 *     lockstep counterpart. It is resolved again, in the index of the
 *     document its componentRef names (the instance's own document when the
 *     ref names none), and walked against that component.
 *  5) Plain descendants are diffed against their counterpart, keyed by name.
 *     Siblings sharing a name are told apart by position: the first keeps
 *     the bare name, later ones get {@code name#1}, {@code name#2}, ...
 *  6) All entries land in one flat map; on a key collision the first
 *     occurrence stays.
 * <p>
 * Data problems (unresolved references, unmatched children, key collisions)
 * only produce diagnostics; this method always returns a map.
 * <p>
 * Holds no mutable state: one walker may serve any number of threads.
 */
public final class OverrideTreeWalker {

    private final AttributeDiffer differ;
    private final ReferenceResolver resolver;
    private final IndexCatalog catalog;
    private final OverrideDiagnostics diagnostics;

    public OverrideTreeWalker(
            AttributeDiffer differ,
            ReferenceResolver resolver,
            IndexCatalog catalog,
            OverrideDiagnostics diagnostics
    ) {
        this.differ = Objects.requireNonNull(differ, "differ");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    }

    public static OverrideTreeWalker create(DiffPolicy policy, IndexCatalog catalog, OverrideDiagnostics diagnostics) {
        return new OverrideTreeWalker(
                new AttributeDiffer(policy),
                new ReferenceResolver(diagnostics),
                catalog,
                diagnostics
        );
    }

    /**
     * Same as {@link #computeOverrides(Node, ReferenceIndex, String)} for an
     * instance living in the document of its own component.
     */
    public OverrideMap computeOverrides(Node instanceRoot, ReferenceIndex rootIndex) {
        return computeOverrides(instanceRoot, rootIndex, rootIndex.documentId());
    }

    /**
     * @param instanceRoot       the instance to compute overrides for
     * @param rootIndex          index of the document that owns the instance's component
     * @param instanceDocumentId document the instance tree belongs to; nested
     *                           instances whose componentRef names no document
     *                           resolve there
     */
    public OverrideMap computeOverrides(Node instanceRoot, ReferenceIndex rootIndex, String instanceDocumentId) {
        Objects.requireNonNull(instanceRoot, "instanceRoot");
        Objects.requireNonNull(rootIndex, "rootIndex");

        Optional<Resolution> resolution = resolver.resolve(instanceRoot, rootIndex);
        if (resolution.isEmpty()) {
            return OverrideMap.empty();
        }

        Accumulator acc = new Accumulator(instanceDocumentId);
        Node reference = resolution.get().reference();
        diffNode(instanceRoot, reference, rootKey(instanceRoot), true, acc);
        walkChildren(instanceRoot, reference, rootIndex, acc);
        return acc.build();
    }

    /** Key of a root instance: its variant group name when it has one, its own name otherwise. */
    public static String rootKey(Node instance) {
        ComponentRef ref = instance.componentRef();
        if (ref != null && ref.hasVariantGroup()) return ref.componentSetName();
        if (!instance.name().isEmpty()) return instance.name();
        if (ref != null && ref.componentName() != null) return ref.componentName();
        return instance.id();
    }

    private void walkChildren(Node instance, Node reference, ReferenceIndex index, Accumulator acc) {
        List<Node> children = instance.children();
        List<Node> counterparts = ChildMatcher.match(children, reference.children());
        List<String> keys = siblingKeys(children);

        for (int i = 0; i < children.size(); i++) {
            Node child = children.get(i);
            if (child.isInstance()) {
                walkNestedInstance(child, keys.get(i), index, acc);
                continue;
            }
            Node counterpart = counterparts.get(i);
            if (counterpart == null) {
                if (diagnostics.enabled()) {
                    diagnostics.emit(new DiagnosticEvent.UnmatchedDescendant(child.id(), child.name(), reference.id()));
                }
                continue;
            }
            diffNode(child, counterpart, keys.get(i), false, acc);
            walkChildren(child, counterpart, index, acc);
        }
    }

    private void walkNestedInstance(Node nested, String key, ReferenceIndex enclosing, Accumulator acc) {
        String documentId = nested.componentRef().documentId();
        if (documentId == null) documentId = acc.instanceDocumentId;
        Optional<ReferenceIndex> index = documentId == null || documentId.equals(enclosing.documentId())
                ? Optional.of(enclosing)
                : catalog.indexFor(documentId);

        if (index.isEmpty()) {
            if (diagnostics.enabled()) {
                diagnostics.emit(new DiagnosticEvent.ResolutionFailed(
                        nested.id(), documentId, "library document not loaded"));
            }
            return;
        }

        Optional<Resolution> resolution = resolver.resolve(nested, index.get());
        if (resolution.isEmpty()) {
            return;
        }
        Node reference = resolution.get().reference();
        diffNode(nested, reference, key, true, acc);
        walkChildren(nested, reference, index.get(), acc);
    }

    private void diffNode(Node instance, Node reference, String key, boolean componentRoot, Accumulator acc) {
        Optional<StyleDelta> style = differ.diffStyle(
                instance.style(), reference.style(), StyleScope.of(instance, componentRoot));
        Optional<ContentDelta> content = differ.diffContent(instance.content(), reference.content());

        if (style.isEmpty() && content.isEmpty()) {
            if (diagnostics.enabled()) {
                diagnostics.emit(new DiagnosticEvent.DiffSuppressed(key, instance.id()));
            }
            return;
        }

        OverrideEntry entry = new OverrideEntry(style.orElse(null), content.orElse(null));
        if (diagnostics.enabled()) {
            diagnostics.emit(new DiagnosticEvent.DiffFound(
                    key,
                    instance.id(),
                    style.map(StyleDelta::fieldNames).orElse(List.of()),
                    content.map(ContentDelta::fieldNames).orElse(List.of())
            ));
        }
        acc.put(key, instance.id(), entry);
    }

    private static String descendantKey(Node node) {
        return node.name().isEmpty() ? node.id() : node.name();
    }

    /** Keys of one sibling list: the name, suffixed with #n for the n-th repeat of that name. */
    static List<String> siblingKeys(List<Node> siblings) {
        List<String> keys = new ArrayList<>(siblings.size());
        Map<String, Integer> seen = new HashMap<>();
        for (Node n : siblings) {
            String base = descendantKey(n);
            int repeat = seen.merge(base, 1, Integer::sum) - 1;
            keys.add(repeat == 0 ? base : base + "#" + repeat);
        }
        return keys;
    }

    /** Per-call result buffer. */
    private final class Accumulator {
        private final String instanceDocumentId;
        private final Map<String, OverrideEntry> entries = new LinkedHashMap<>();
        private final Map<String, String> owners = new HashMap<>();

        Accumulator(String instanceDocumentId) {
            this.instanceDocumentId = instanceDocumentId;
        }

        void put(String key, String nodeId, OverrideEntry entry) {
            String owner = owners.putIfAbsent(key, nodeId);
            if (owner != null) {
                if (diagnostics.enabled()) {
                    diagnostics.emit(new DiagnosticEvent.KeyCollision(key, owner, nodeId));
                }
                return;
            }
            entries.put(key, entry);
        }

        OverrideMap build() {
            return OverrideMap.of(entries);
        }
    }
}
