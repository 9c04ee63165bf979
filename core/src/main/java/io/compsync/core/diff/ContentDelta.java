// file: core/src/main/java/io/compsync/core/diff/ContentDelta.java
package io.compsync.core.diff;

import io.compsync.core.model.ContentKind;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Sparse content override.
 * <p>
 *  - kind:     content kind of the instance.
 *  - changes:  instance-side value of every differing content field.
 *  - replaced: the instance's content kind differs from the reference's;
 *              changes then hold every field of the instance payload and the
 *              consumer must swap the whole payload.
 * Never empty: either at least one change, or a replacement.
 */
public final class ContentDelta {

    private final ContentKind kind;
    private final Map<ContentField, Object> changes;
    private final boolean replaced;

    public ContentDelta(ContentKind kind, Map<ContentField, Object> changes, boolean replaced) {
        this.kind = Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(changes, "changes");
        if (changes.isEmpty() && !replaced) {
            throw new IllegalArgumentException("a content delta must change at least one field");
        }
        for (ContentField f : changes.keySet()) {
            if (f.kind() != kind) {
                throw new IllegalArgumentException(f + " does not belong to content kind " + kind);
            }
        }
        this.changes = changes.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(changes));
        this.replaced = replaced;
    }

    public ContentKind kind() { return kind; }

    public Map<ContentField, Object> changes() { return changes; }

    public Set<ContentField> fields() { return changes.keySet(); }

    public boolean changed(ContentField field) { return changes.containsKey(field); }

    public Object value(ContentField field) { return changes.get(field); }

    public boolean replaced() { return replaced; }

    public List<String> fieldNames() {
        return changes.keySet().stream().map(Enum::name).toList();
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ContentDelta d)) return false;
        return kind == d.kind && replaced == d.replaced && changes.equals(d.changes);
    }

    @Override public int hashCode() { return Objects.hash(kind, changes, replaced); }

    @Override public String toString() {
        return "ContentDelta[" + kind + (replaced ? " replaced " : " ") + changes + "]";
    }
}
