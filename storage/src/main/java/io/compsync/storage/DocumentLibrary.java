// file: storage/src/main/java/io/compsync/storage/DocumentLibrary.java
package io.compsync.storage;

import io.compsync.core.diag.OverrideDiagnostics;
import io.compsync.core.index.NodeIndexer;
import io.compsync.core.index.ReferenceIndex;
import io.compsync.core.model.Document;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * In-memory {@link DocumentStore}.
 * <p>
 * Each document is held together with its index as one immutable snapshot,
 * swapped in a single map write, so a concurrent reader sees either the old
 * pair or the new pair.
 */
public class DocumentLibrary implements DocumentStore {
    private static final Logger log = Logger.getLogger(DocumentLibrary.class.getName());

    private record Snapshot(Document document, ReferenceIndex index) {}

    private final Map<String, Snapshot> docs = new ConcurrentHashMap<>();
    private final NodeIndexer indexer;

    public DocumentLibrary(OverrideDiagnostics diagnostics) {
        this.indexer = new NodeIndexer(diagnostics);
    }

    public DocumentLibrary() {
        this(OverrideDiagnostics.NOOP);
    }

    @Override
    public ReferenceIndex load(Document document) {
        Objects.requireNonNull(document, "document");
        ReferenceIndex index = indexer.build(document);
        Snapshot previous = docs.put(document.id(), new Snapshot(document, index));
        log.info(() -> (previous == null ? "loaded" : "reloaded")
                + " document " + document.id() + " (" + index.size() + " nodes)");
        return index;
    }

    @Override
    public Optional<ReferenceIndex> indexFor(String documentId) {
        if (documentId == null) return Optional.empty();
        Snapshot s = docs.get(documentId);
        return s == null ? Optional.empty() : Optional.of(s.index());
    }

    @Override
    public Optional<Document> document(String documentId) {
        if (documentId == null) return Optional.empty();
        Snapshot s = docs.get(documentId);
        return s == null ? Optional.empty() : Optional.of(s.document());
    }

    @Override
    public boolean unload(String documentId) {
        boolean removed = documentId != null && docs.remove(documentId) != null;
        if (removed) log.info(() -> "unloaded document " + documentId);
        return removed;
    }

    @Override
    public Set<String> documentIds() {
        return new TreeSet<>(docs.keySet());
    }

    /**
     * Load every {@code *.json} file of a directory, in file-name order.
     * Files that fail to parse are logged and skipped.
     *
     * @return ids of the documents loaded.
     */
    public List<String> loadDirectory(Path dir, DocumentReader reader) throws IOException {
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*.json")) {
            for (Path p : stream) {
                if (Files.isRegularFile(p)) files.add(p);
            }
        }
        files.sort(null);

        List<String> loaded = new ArrayList<>();
        for (Path p : files) {
            try {
                Document d = reader.read(p);
                load(d);
                loaded.add(d.id());
            } catch (DocumentFormatException e) {
                log.log(Level.WARNING, "skipping " + p.getFileName() + ": " + e.getMessage(), e);
            }
        }
        return loaded;
    }
}
