// file: storage/src/main/java/io/compsync/storage/DocumentStore.java
package io.compsync.storage;

import io.compsync.core.index.ReferenceIndex;
import io.compsync.core.model.Document;
import io.compsync.core.resolve.IndexCatalog;

import java.util.Optional;
import java.util.Set;

/**
 * Registry of loaded documents used by the server layer.
 * <p>
 * Semantics:
 *  - load() indexes the document and publishes document and index together;
 *    loading an id that is already present replaces both.
 *  - indexFor() (from {@link IndexCatalog}) never sees a half-built index.
 *  - unload() removes a document; readers holding an old index keep using it.
 */
public interface DocumentStore extends IndexCatalog {

    /** Index and publish a document. Returns the new index. */
    ReferenceIndex load(Document document);

    Optional<Document> document(String documentId);

    /** @return true if the document was loaded. */
    boolean unload(String documentId);

    Set<String> documentIds();
}
