// file: core/src/main/java/io/compsync/core/diff/StyleDelta.java
package io.compsync.core.diff;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Sparse style override: the instance-side value of every style field that
 * differs from the reference. Never empty.
 * <p>
 * Value types per field:
 *  - Double:     X, Y, WIDTH, HEIGHT, ITEM_SPACING, STROKE_WIDTH, CORNER_RADIUS,
 *                OPACITY, FONT_SIZE, LINE_HEIGHT, LETTER_SPACING
 *  - Boolean:    VISIBLE
 *  - Integer:    FONT_WEIGHT
 *  - String:     FONT_FAMILY
 *  - Color:      TEXT_COLOR
 *  - Insets:     PADDING
 *  - List<Paint>: FILLS, STROKES
 *  - enums:      POSITIONING, *_SIZING, LAYOUT_MODE, TEXT_ALIGN
 */
public final class StyleDelta {

    private final Map<StyleField, Object> changes;

    public StyleDelta(Map<StyleField, Object> changes) {
        Objects.requireNonNull(changes, "changes");
        if (changes.isEmpty()) throw new IllegalArgumentException("a style delta must change at least one field");
        this.changes = Collections.unmodifiableMap(new EnumMap<>(changes));
    }

    /** Changed fields in declaration order. */
    public Set<StyleField> fields() {
        return changes.keySet();
    }

    public boolean changed(StyleField field) {
        return changes.containsKey(field);
    }

    /** Instance-side value of a changed field, or null if the field did not change. */
    public Object value(StyleField field) {
        return changes.get(field);
    }

    public Map<StyleField, Object> changes() {
        return changes;
    }

    public boolean touches(StyleField.Group group) {
        for (StyleField f : changes.keySet()) {
            if (f.group() == group) return true;
        }
        return false;
    }

    public List<String> fieldNames() {
        return changes.keySet().stream().map(Enum::name).toList();
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StyleDelta d)) return false;
        return changes.equals(d.changes);
    }

    @Override public int hashCode() { return changes.hashCode(); }

    @Override public String toString() { return "StyleDelta" + changes; }
}
