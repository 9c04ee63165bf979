// file: storage/src/main/java/io/compsync/storage/DocumentFormatException.java
package io.compsync.storage;

/**
 * Raised when a document cannot be turned into a node tree:
 * invalid JSON, missing identities, unknown enum values.
 */
public class DocumentFormatException extends RuntimeException {
    public DocumentFormatException(String message) {
        super(message);
    }

    public DocumentFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
