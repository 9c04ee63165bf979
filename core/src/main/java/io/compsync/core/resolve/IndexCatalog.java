// file: core/src/main/java/io/compsync/core/resolve/IndexCatalog.java
package io.compsync.core.resolve;

import io.compsync.core.index.ReferenceIndex;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Source of already-built indices, one per loaded document.
 * Fetching and parsing library documents happens before the engine runs;
 * the catalog only hands out what has been loaded.
 */
@FunctionalInterface
public interface IndexCatalog {

    Optional<ReferenceIndex> indexFor(String documentId);

    static IndexCatalog empty() {
        return id -> Optional.empty();
    }

    /** Catalog over a fixed set of indices, keyed by their document id. */
    static IndexCatalog of(ReferenceIndex... indices) {
        var m = new HashMap<String, ReferenceIndex>();
        for (var idx : indices) m.putIfAbsent(idx.documentId(), idx);
        Map<String, ReferenceIndex> frozen = Map.copyOf(m);
        return id -> id == null ? Optional.empty() : Optional.ofNullable(frozen.get(id));
    }
}
