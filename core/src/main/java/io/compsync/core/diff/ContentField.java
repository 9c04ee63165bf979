// file: core/src/main/java/io/compsync/core/diff/ContentField.java
package io.compsync.core.diff;

import io.compsync.core.model.ContentKind;

/** Fields of each content variant that can carry an override. */
public enum ContentField {
    CLIPS_CONTENT(ContentKind.CONTAINER),
    FILLS_ENABLED(ContentKind.CONTAINER),
    STROKES_ENABLED(ContentKind.CONTAINER),
    EFFECTS_ENABLED(ContentKind.CONTAINER),
    TEXT(ContentKind.TEXT),
    RUNS(ContentKind.STYLED_TEXT),
    IMAGE_REF(ContentKind.IMAGE),
    SCALE_MODE(ContentKind.IMAGE),
    GEOMETRY_REF(ContentKind.VECTOR),
    OTHER_TYPE(ContentKind.OTHER);

    private final ContentKind kind;

    ContentField(ContentKind kind) {
        this.kind = kind;
    }

    public ContentKind kind() {
        return kind;
    }
}
