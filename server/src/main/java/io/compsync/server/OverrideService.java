// file: server/src/main/java/io/compsync/server/OverrideService.java
package io.compsync.server;

import io.compsync.core.diag.DiagnosticEvent;
import io.compsync.core.diag.OverrideDiagnostics;
import io.compsync.core.diff.DiffPolicy;
import io.compsync.core.index.ReferenceIndex;
import io.compsync.core.model.Document;
import io.compsync.core.model.Node;
import io.compsync.core.override.OverrideMap;
import io.compsync.core.override.OverrideTreeWalker;
import io.compsync.core.sync.ComponentInfo;
import io.compsync.storage.DocumentReader;
import io.compsync.storage.DocumentStore;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * Application service for override computation.
 *
 * Responsibilities:
 *  - Hide parsing and indexing from the HTTP layer.
 *  - Pick the reference index for an instance: the document its componentRef
 *    names, or the instance's own document when the ref names none.
 *  - Fan out whole-document computations over a fixed worker pool. Each task
 *    only reads immutable snapshots, so no locking is needed.
 */
public class OverrideService implements AutoCloseable {
    private static final Logger log = Logger.getLogger(OverrideService.class.getName());

    /** Summary of a document load. */
    public record LoadResult(String documentId, int nodes, int instances) {}

    /** Overrides of one top-level instance of a document. */
    public record InstanceOverrides(String nodeId, String nodeName, ComponentInfo info) {}

    private final DocumentStore store;
    private final DocumentReader reader;
    private final OverrideTreeWalker walker;
    private final OverrideDiagnostics diagnostics;
    private final ExecutorService workers;

    public OverrideService(DocumentStore store, DiffPolicy policy, OverrideDiagnostics diagnostics, int workers) {
        if (workers <= 0) throw new IllegalArgumentException("workers must be > 0");
        this.store = Objects.requireNonNull(store, "store");
        this.reader = new DocumentReader();
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
        this.walker = OverrideTreeWalker.create(policy, store, diagnostics);
        this.workers = Executors.newFixedThreadPool(workers, r -> {
            Thread t = new Thread(r, "override-worker");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Parse and load a JSON document.
     *
     * @param expectedId id from the request path; must match the document's own id
     */
    public LoadResult loadDocument(String expectedId, byte[] json) {
        Document doc = reader.read(json);
        if (expectedId != null && !expectedId.equals(doc.id())) {
            throw new IllegalArgumentException(
                    "document id mismatch: path=" + expectedId + " body=" + doc.id());
        }
        ReferenceIndex index = store.load(doc);
        return new LoadResult(doc.id(), index.size(), topLevelInstances(doc).size());
    }

    /**
     * Compute the overrides of one instance.
     *
     * @throws UnknownDocumentException if the document is not loaded
     * @throws IllegalArgumentException if the node does not exist or is not an instance
     */
    public ComponentInfo componentInfo(String documentId, String nodeId) {
        ReferenceIndex index = store.indexFor(documentId)
                .orElseThrow(() -> new UnknownDocumentException(documentId));
        Node node = index.byId(nodeId)
                .orElseThrow(() -> new IllegalArgumentException("unknown node " + nodeId + " in " + documentId));
        if (!node.isInstance()) {
            throw new IllegalArgumentException("node " + nodeId + " is not an instance");
        }
        return compute(documentId, node);
    }

    /**
     * Compute every top-level instance of a document in parallel.
     * Results come back in document order.
     */
    public List<InstanceOverrides> computeAll(String documentId) {
        Document doc = store.document(documentId)
                .orElseThrow(() -> new UnknownDocumentException(documentId));

        List<Node> instances = topLevelInstances(doc);
        List<Future<ComponentInfo>> futures = new ArrayList<>(instances.size());
        for (Node n : instances) {
            futures.add(workers.submit(() -> compute(documentId, n)));
        }

        List<InstanceOverrides> out = new ArrayList<>(instances.size());
        for (int i = 0; i < instances.size(); i++) {
            Node n = instances.get(i);
            out.add(new InstanceOverrides(n.id(), n.name(), await(futures.get(i))));
        }
        log.fine(() -> "computed " + out.size() + " instances of " + documentId);
        return out;
    }

    public DocumentStore store() {
        return store;
    }

    @Override
    public void close() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    // ---------- internals ----------

    private ComponentInfo compute(String documentId, Node instance) {
        String refDoc = instance.componentRef().documentId();
        String target = refDoc == null ? documentId : refDoc;
        Optional<ReferenceIndex> refIndex = store.indexFor(target);
        if (refIndex.isEmpty()) {
            if (diagnostics.enabled()) {
                diagnostics.emit(new DiagnosticEvent.ResolutionFailed(
                        instance.id(), target, "library document not loaded"));
            }
            return ComponentInfo.of(instance, OverrideMap.empty());
        }
        return ComponentInfo.of(instance, walker.computeOverrides(instance, refIndex.get(), documentId));
    }

    /** Instances that are not nested inside another instance, in document order. */
    static List<Node> topLevelInstances(Document doc) {
        List<Node> out = new ArrayList<>();
        Deque<Node> stack = new ArrayDeque<>();
        stack.push(doc.root());
        while (!stack.isEmpty()) {
            Node n = stack.pop();
            if (n.isInstance()) {
                out.add(n);
                continue;
            }
            List<Node> children = n.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return out;
    }

    private static <T> T await(Future<T> f) {
        try {
            return f.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while computing overrides", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) throw re;
            throw new IllegalStateException(cause);
        }
    }
}
