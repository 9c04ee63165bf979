// file: core/src/main/java/io/compsync/core/model/ContentPayload.java
package io.compsync.core.model;

import java.util.List;

/**
 * Type-specific content of a node.
 * <p>
 * Closed set of variants; the differ has one rule per variant.
 * Children are not part of the payload, they live on {@link Node}.
 */
public sealed interface ContentPayload
        permits ContentPayload.Container,
                ContentPayload.Text,
                ContentPayload.StyledText,
                ContentPayload.Image,
                ContentPayload.Vector,
                ContentPayload.Other {

    ContentKind kind();

    /** Frame, group, component or instance body. */
    record Container(
            boolean clipsContent,
            boolean fillsEnabled,
            boolean strokesEnabled,
            boolean effectsEnabled
    ) implements ContentPayload {
        public static final Container DEFAULT = new Container(false, true, true, true);

        @Override public ContentKind kind() { return ContentKind.CONTAINER; }
    }

    /** Single-style text; the style comes from the node's {@link StyleBundle#text()}. */
    record Text(String text) implements ContentPayload {
        public Text {
            if (text == null) text = "";
        }

        @Override public ContentKind kind() { return ContentKind.TEXT; }
    }

    /** Text made of individually styled runs. */
    record StyledText(List<TextRun> runs) implements ContentPayload {
        public StyledText {
            runs = runs == null ? List.of() : List.copyOf(runs);
        }

        @Override public ContentKind kind() { return ContentKind.STYLED_TEXT; }
    }

    record Image(String imageRef, ScaleMode scaleMode) implements ContentPayload {
        public enum ScaleMode { FILL, FIT, CROP, TILE }

        @Override public ContentKind kind() { return ContentKind.IMAGE; }
    }

    /** Vector geometry is referenced, never compared. */
    record Vector(String geometryRef) implements ContentPayload {
        @Override public ContentKind kind() { return ContentKind.VECTOR; }
    }

    /** Any other leaf kind (line, slice, widget ...), identified by its type name. */
    record Other(String type) implements ContentPayload {
        @Override public ContentKind kind() { return ContentKind.OTHER; }
    }
}
