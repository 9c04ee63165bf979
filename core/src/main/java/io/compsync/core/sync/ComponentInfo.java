// file: core/src/main/java/io/compsync/core/sync/ComponentInfo.java
package io.compsync.core.sync;

import io.compsync.core.model.ComponentRef;
import io.compsync.core.model.Node;
import io.compsync.core.override.OverrideEntry;
import io.compsync.core.override.OverrideMap;
import io.compsync.core.override.OverrideTreeWalker;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * What a replacement consumer gets to know about an instance: which library
 * component it came from and the overrides computed against it.
 */
public record ComponentInfo(
        String componentId,
        String componentName,
        String componentSetName,
        String rootKey,
        OverrideMap overrides
) {
    public ComponentInfo {
        if (overrides == null) overrides = OverrideMap.empty();
    }

    public static ComponentInfo of(Node instance, OverrideMap overrides) {
        ComponentRef ref = instance.componentRef();
        if (ref == null) {
            return new ComponentInfo(null, null, null, instance.name(), OverrideMap.empty());
        }
        return new ComponentInfo(
                ref.componentId(),
                ref.componentName(),
                ref.componentSetName(),
                OverrideTreeWalker.rootKey(instance),
                overrides
        );
    }

    /** Override of the instance root itself, if any. */
    public Optional<OverrideEntry> rootOverride() {
        return overrides.get(rootKey);
    }

    /** Every override except the root's, in document order. */
    public Map<String, OverrideEntry> descendantOverrides() {
        Map<String, OverrideEntry> out = new LinkedHashMap<>(overrides.asMap());
        out.remove(rootKey);
        return out;
    }

    public LibrarySyncMode syncMode() {
        return LibrarySyncMode.classify(this);
    }
}
