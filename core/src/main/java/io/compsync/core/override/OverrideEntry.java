// file: core/src/main/java/io/compsync/core/override/OverrideEntry.java
package io.compsync.core.override;

import io.compsync.core.diff.ContentDelta;
import io.compsync.core.diff.StyleDelta;

/**
 * Override of a single node: a style delta, a content delta, or both.
 * An entry with neither is not an override and cannot be constructed.
 */
public record OverrideEntry(StyleDelta style, ContentDelta content) {

    public OverrideEntry {
        if (style == null && content == null) {
            throw new IllegalArgumentException("override entry needs a style or a content delta");
        }
    }

    public boolean hasStyle() {
        return style != null;
    }

    public boolean hasContent() {
        return content != null;
    }
}
