// file: server/src/main/java/io/compsync/server/UnknownDocumentException.java
package io.compsync.server;

/** The requested document id is not loaded. Mapped to HTTP 404. */
public class UnknownDocumentException extends RuntimeException {
    public UnknownDocumentException(String documentId) {
        super("unknown document: " + documentId);
    }
}
