// file: core/src/main/java/io/compsync/core/model/Document.java
package io.compsync.core.model;

import java.util.Objects;

/**
 * A fully parsed document: a specification document or a component library.
 */
public record Document(String id, String name, Node root) {
    public Document {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(root, "root");
        if (id.isBlank()) throw new IllegalArgumentException("document id must not be blank");
        if (name == null) name = id;
    }
}
