// file: storage/src/main/java/io/compsync/storage/CorruptRecordException.java
package io.compsync.storage;

/** A framed override record failed magic, version, length or CRC validation. */
public class CorruptRecordException extends RuntimeException {
    public CorruptRecordException(String message) {
        super(message);
    }

    public CorruptRecordException(String message, Throwable cause) {
        super(message, cause);
    }
}
