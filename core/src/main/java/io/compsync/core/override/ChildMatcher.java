// file: core/src/main/java/io/compsync/core/override/ChildMatcher.java
package io.compsync.core.override;

import io.compsync.core.model.Node;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Pairs the children of an instance node with the children of its reference node.
 * <p>
 * Two passes:
 *  1) by name: each instance child takes the first unclaimed reference child
 *     with the same name (several children sharing a name pair up in
 *     document order),
 *  2) by position: an instance child still unmatched takes the reference
 *     child at the same index, if that one is unclaimed.
 * Anything left has no counterpart.
 */
final class ChildMatcher {

    private ChildMatcher() {}

    /**
     * @return list parallel to {@code instanceChildren}; element i is the
     *         counterpart of instance child i, or null
     */
    static List<Node> match(List<Node> instanceChildren, List<Node> referenceChildren) {
        int n = instanceChildren.size();
        Node[] out = new Node[n];
        boolean[] claimed = new boolean[referenceChildren.size()];

        Map<String, Deque<Integer>> byName = new HashMap<>();
        for (int j = 0; j < referenceChildren.size(); j++) {
            String name = referenceChildren.get(j).name();
            if (!name.isEmpty()) {
                byName.computeIfAbsent(name, k -> new ArrayDeque<>()).addLast(j);
            }
        }

        // pass 1: names
        for (int i = 0; i < n; i++) {
            String name = instanceChildren.get(i).name();
            if (name.isEmpty()) continue;
            Deque<Integer> q = byName.get(name);
            if (q == null || q.isEmpty()) continue;
            int j = q.pollFirst();
            claimed[j] = true;
            out[i] = referenceChildren.get(j);
        }

        // pass 2: positions
        for (int i = 0; i < n; i++) {
            if (out[i] != null) continue;
            if (i < referenceChildren.size() && !claimed[i]) {
                claimed[i] = true;
                out[i] = referenceChildren.get(i);
            }
        }
        return new ArrayList<>(Arrays.asList(out));
    }
}
