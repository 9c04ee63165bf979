// file: core/src/main/java/io/compsync/core/index/ReferenceIndex.java
package io.compsync.core.index;

import io.compsync.core.model.Node;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only lookup tables over one document.
 * <p>
 * Built once per document load by {@link NodeIndexer} and never mutated
 * afterwards, so it can be shared between threads without locking.
 * <p>
 *  - byId:      identity -> node (first occurrence wins).
 *  - byName:    name -> all nodes with that name, in document order.
 *  - byVariant: (name, variant group) -> node (first occurrence wins).
 */
public final class ReferenceIndex {

    private final String documentId;
    private final Map<String, Node> byId;
    private final Map<String, List<Node>> byName;
    private final Map<VariantKey, Node> byVariant;

    ReferenceIndex(
            String documentId,
            Map<String, Node> byId,
            Map<String, List<Node>> byName,
            Map<VariantKey, Node> byVariant
    ) {
        this.documentId = documentId;
        this.byId = Map.copyOf(byId);
        this.byName = Map.copyOf(byName);
        this.byVariant = Map.copyOf(byVariant);
    }

    public String documentId() {
        return documentId;
    }

    public Optional<Node> byId(String id) {
        if (id == null) return Optional.empty();
        return Optional.ofNullable(byId.get(id));
    }

    /** First node with this name in document order. */
    public Optional<Node> byName(String name) {
        List<Node> all = candidatesByName(name);
        return all.isEmpty() ? Optional.empty() : Optional.of(all.get(0));
    }

    /** All nodes with this name in document order (possibly empty). */
    public List<Node> candidatesByName(String name) {
        if (name == null) return List.of();
        return byName.getOrDefault(name, List.of());
    }

    public Optional<Node> byVariant(String name, String variantGroup) {
        if (name == null || variantGroup == null) return Optional.empty();
        return Optional.ofNullable(byVariant.get(new VariantKey(name, variantGroup)));
    }

    /** Number of distinct identities indexed. */
    public int size() {
        return byId.size();
    }
}
