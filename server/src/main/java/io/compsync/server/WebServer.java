// file: server/src/main/java/io/compsync/server/WebServer.java
package io.compsync.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.compsync.core.diff.ContentDelta;
import io.compsync.core.diff.ContentField;
import io.compsync.core.diff.StyleField;
import io.compsync.core.override.OverrideEntry;
import io.compsync.core.sync.ComponentInfo;
import io.compsync.server.dto.DocumentOverridesResponse;
import io.compsync.server.dto.LoadResponse;
import io.compsync.server.dto.OverrideEntryDto;
import io.compsync.server.dto.OverridesResponse;
import io.compsync.storage.DocumentFormatException;
import io.compsync.storage.OverrideRecordCodec;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Thin HTTP adapter over {@link OverrideService}.
 *
 * Responsibilities:
 *  - Parse HTTP method + path.
 *  - Hand document bodies to the service.
 *  - Convert computed overrides into JSON (or a framed record on request).
 *  - Map Java exceptions to HTTP status codes.
 *  - Emit per-request logging.
 *
 * Path layout:
 *   - PUT /documents/{id}                                  load or replace a document
 *   - GET /documents/{id}/instances/{nodeId}/overrides     overrides of one instance
 *         ?format=record                                   framed binary record instead of JSON
 *   - GET /documents/{id}/overrides                        overrides of every top-level instance
 *   - GET /admin/health                                    basic health check
 *
 * Status codes: 400 bad input or invalid JSON, 404 unknown document or route,
 * 405 wrong method, 413 body over 10 MiB, 500 anything else.
 */
public final class WebServer {
    static final int MAX_BODY_BYTES = 10 * 1024 * 1024; // 10 MiB
    private static final String PREFIX = "/documents/";

    private final Undertow server;
    private final ObjectMapper json = new ObjectMapper();
    private final OverrideRecordCodec codec = new OverrideRecordCodec();
    private final OverrideService service;

    public WebServer(int port, OverrideService service) {
        this.service = service;

        this.server = Undertow.builder()
                .addHttpListener(port, "0.0.0.0")
                .setHandler(exchange -> {
                    var path = exchange.getRequestPath();
                    var method = exchange.getRequestMethod().toString();
                    exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");

                    if (path.startsWith(PREFIX)) {
                        String[] parts = path.substring(PREFIX.length()).split("/", -1);
                        if (parts[0].isBlank()) {
                            reject(exchange, method, path, 400, "document id must not be empty");
                        } else if (parts.length == 1) {
                            if ("PUT".equals(method)) {
                                handleLoad(exchange, parts[0]);
                            } else {
                                reject(exchange, method, path, 405, "method not allowed");
                            }
                        } else if (parts.length == 2 && "overrides".equals(parts[1])) {
                            if ("GET".equals(method)) {
                                handleDocumentOverrides(exchange, parts[0]);
                            } else {
                                reject(exchange, method, path, 405, "method not allowed");
                            }
                        } else if (parts.length == 4 && "instances".equals(parts[1]) && "overrides".equals(parts[3])) {
                            if (parts[2].isBlank()) {
                                reject(exchange, method, path, 400, "node id must not be empty");
                            } else if ("GET".equals(method)) {
                                handleInstanceOverrides(exchange, parts[0], parts[2]);
                            } else {
                                reject(exchange, method, path, 405, "method not allowed");
                            }
                        } else {
                            reject(exchange, method, path, 404, "not found");
                        }
                    } else if ("/admin/health".equals(path)) {
                        send(exchange, 200, Map.of(
                                "status", "ok",
                                "documents", service.store().documentIds().size()));
                        RequestLogger.logRequest(method, path, 200, 0, -1, null);
                    } else {
                        reject(exchange, method, path, 404, "not found");
                    }
                }).build();
    }

    public void start() {
        server.start();
    }

    public void stop() {
        server.stop();
    }

    // ---------- handlers ----------

    /** PUT /documents/{id} */
    private void handleLoad(HttpServerExchange ex, String documentId) {
        ex.getRequestReceiver().receiveFullBytes(
                (exchange, data) -> {
                    String path = exchange.getRequestPath();
                    long start = System.nanoTime();
                    int status;
                    long computeMs = -1L;
                    Throwable error = null;

                    try {
                        if (data.length > MAX_BODY_BYTES) {
                            status = 413;
                            send(exchange, status, Map.of("error", "request body too large"));
                        } else {
                            long cStart = System.nanoTime();
                            OverrideService.LoadResult r = service.loadDocument(documentId, data);
                            computeMs = (System.nanoTime() - cStart) / 1_000_000L;

                            var dto = new LoadResponse();
                            dto.documentId = r.documentId();
                            dto.nodes = r.nodes();
                            dto.instances = r.instances();
                            status = 200;
                            send(exchange, status, dto);
                        }
                    } catch (DocumentFormatException | IllegalArgumentException bad) {
                        status = 400;
                        error = bad;
                        send(exchange, status, Map.of("error", bad.getMessage()));
                    } catch (Exception e) {
                        status = 500;
                        error = e;
                        send(exchange, status, errorBody(e));
                    } finally {
                        long totalMs = (System.nanoTime() - start) / 1_000_000L;
                        RequestLogger.logRequest("PUT", path, exchange.getStatusCode(), totalMs, computeMs, error);
                    }
                },
                (exchange, ioEx) -> {
                    int status = 400;
                    send(exchange, status, Map.of("error", "invalid request body"));
                    RequestLogger.logRequest("PUT", exchange.getRequestPath(), status, 0, -1, ioEx);
                }
        );
    }

    /** GET /documents/{id}/instances/{nodeId}/overrides */
    private void handleInstanceOverrides(HttpServerExchange ex, String documentId, String nodeId) {
        long start = System.nanoTime();
        int status = 200;
        long computeMs = -1L;
        Throwable error = null;
        try {
            long cStart = System.nanoTime();
            ComponentInfo info = service.componentInfo(documentId, nodeId);
            computeMs = (System.nanoTime() - cStart) / 1_000_000L;

            if ("record".equals(firstOrNull(ex.getQueryParameters().get("format")))) {
                ex.setStatusCode(status);
                ex.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/octet-stream");
                ex.getResponseSender().send(ByteBuffer.wrap(codec.encode(info.overrides())));
            } else {
                send(ex, status, toDto(documentId, nodeId, null, info));
            }
        } catch (UnknownDocumentException missing) {
            status = 404;
            error = missing;
            send(ex, status, Map.of("error", missing.getMessage()));
        } catch (IllegalArgumentException bad) {
            status = 400;
            error = bad;
            send(ex, status, Map.of("error", bad.getMessage()));
        } catch (Exception e) {
            status = 500;
            error = e;
            send(ex, status, errorBody(e));
        } finally {
            long totalMs = (System.nanoTime() - start) / 1_000_000L;
            RequestLogger.logRequest("GET", ex.getRequestPath(), status, totalMs, computeMs, error);
        }
    }

    /** GET /documents/{id}/overrides */
    private void handleDocumentOverrides(HttpServerExchange ex, String documentId) {
        long start = System.nanoTime();
        int status = 200;
        long computeMs = -1L;
        Throwable error = null;
        try {
            long cStart = System.nanoTime();
            List<OverrideService.InstanceOverrides> all = service.computeAll(documentId);
            computeMs = (System.nanoTime() - cStart) / 1_000_000L;

            var dto = new DocumentOverridesResponse();
            dto.documentId = documentId;
            dto.instances = new ArrayList<>(all.size());
            for (OverrideService.InstanceOverrides io : all) {
                dto.instances.add(toDto(documentId, io.nodeId(), io.nodeName(), io.info()));
            }
            send(ex, status, dto);
        } catch (UnknownDocumentException missing) {
            status = 404;
            error = missing;
            send(ex, status, Map.of("error", missing.getMessage()));
        } catch (Exception e) {
            status = 500;
            error = e;
            send(ex, status, errorBody(e));
        } finally {
            long totalMs = (System.nanoTime() - start) / 1_000_000L;
            RequestLogger.logRequest("GET", ex.getRequestPath(), status, totalMs, computeMs, error);
        }
    }

    // ---------- mapping ----------

    static OverridesResponse toDto(String documentId, String nodeId, String nodeName, ComponentInfo info) {
        var dto = new OverridesResponse();
        dto.documentId = documentId;
        dto.nodeId = nodeId;
        dto.nodeName = nodeName;
        dto.componentId = info.componentId();
        dto.componentName = info.componentName();
        dto.componentSetName = info.componentSetName();
        dto.rootKey = info.rootKey();
        dto.syncMode = info.syncMode().name();
        dto.overrides = new LinkedHashMap<>();
        for (Map.Entry<String, OverrideEntry> e : info.overrides().asMap().entrySet()) {
            dto.overrides.put(e.getKey(), toDto(e.getValue()));
        }
        return dto;
    }

    private static OverrideEntryDto toDto(OverrideEntry entry) {
        var dto = new OverrideEntryDto();
        if (entry.hasStyle()) {
            dto.style = new LinkedHashMap<>();
            for (Map.Entry<StyleField, Object> c : entry.style().changes().entrySet()) {
                dto.style.put(c.getKey().name(), c.getValue());
            }
        }
        if (entry.hasContent()) {
            ContentDelta cd = entry.content();
            var content = new OverrideEntryDto.Content();
            content.kind = cd.kind().name();
            content.replaced = cd.replaced();
            content.changes = new LinkedHashMap<>();
            for (Map.Entry<ContentField, Object> c : cd.changes().entrySet()) {
                content.changes.put(c.getKey().name(), c.getValue());
            }
            dto.content = content;
        }
        return dto;
    }

    // ---------- helpers ----------

    private void reject(HttpServerExchange ex, String method, String path, int status, String message) {
        send(ex, status, Map.of("error", message));
        RequestLogger.logRequest(method, path, status, 0, -1, null);
    }

    private static Map<String, Object> errorBody(Exception e) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", e.getClass().getSimpleName());
        body.put("message", e.getMessage());
        return body;
    }

    private static String firstOrNull(Deque<String> deque) {
        return (deque == null || deque.isEmpty()) ? null : deque.getFirst();
    }

    /** Serialize 'body' as JSON and write it with the given HTTP status code. */
    private void send(HttpServerExchange ex, int code, Object body) {
        try {
            ex.setStatusCode(code);
            byte[] bytes = json.writeValueAsBytes(body);
            ex.getResponseSender().send(new String(bytes, StandardCharsets.UTF_8));
        } catch (Exception e) {
            ex.setStatusCode(500);
            ex.getResponseSender().send("{\"error\":\"serialization\"}");
        }
    }
}
