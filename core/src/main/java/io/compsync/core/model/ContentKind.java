// file: core/src/main/java/io/compsync/core/model/ContentKind.java
package io.compsync.core.model;

/** Tag of a {@link ContentPayload} variant. */
public enum ContentKind {
    CONTAINER,
    TEXT,
    STYLED_TEXT,
    IMAGE,
    VECTOR,
    OTHER
}
