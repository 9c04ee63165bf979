// file: core/src/main/java/io/compsync/core/override/OverrideMap.java
package io.compsync.core.override;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable map from override key to {@link OverrideEntry}.
 * <p>
 * Keys:
 *  - the root instance is keyed by its variant group (component set) name,
 *    or by its own name for a plain component,
 *  - every descendant, nested instances included, is keyed by its own name.
 * Iteration order is document order of the instance tree.
 */
public final class OverrideMap {

    private static final OverrideMap EMPTY = new OverrideMap(Map.of());

    private final Map<String, OverrideEntry> entries;

    private OverrideMap(Map<String, OverrideEntry> entries) {
        this.entries = entries;
    }

    public static OverrideMap empty() {
        return EMPTY;
    }

    /** Copy of the given entries, keeping their iteration order. */
    public static OverrideMap of(Map<String, OverrideEntry> entries) {
        if (entries.isEmpty()) return EMPTY;
        for (var e : entries.entrySet()) {
            if (e.getKey() == null || e.getValue() == null) {
                throw new IllegalArgumentException("null key or entry in override map");
            }
        }
        return new OverrideMap(Collections.unmodifiableMap(new LinkedHashMap<>(entries)));
    }

    public Optional<OverrideEntry> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    public boolean containsKey(String key) {
        return entries.containsKey(key);
    }

    public Set<String> keys() {
        return entries.keySet();
    }

    public Map<String, OverrideEntry> asMap() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OverrideMap m)) return false;
        return entries.equals(m.entries);
    }

    @Override public int hashCode() { return entries.hashCode(); }

    @Override public String toString() { return "OverrideMap" + entries; }
}
