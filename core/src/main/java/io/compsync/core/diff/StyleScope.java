// file: core/src/main/java/io/compsync/core/diff/StyleScope.java
package io.compsync.core.diff;

import io.compsync.core.model.ContentKind;
import io.compsync.core.model.Node;

/**
 * Which style fields are meaningful for a particular node.
 *
 * @param placement  compare x / y at all (false for the root instance, whose
 *                   position is its placement in the specification document)
 * @param typography compare the text group (only text nodes carry typography)
 */
public record StyleScope(boolean placement, boolean typography) {

    public static final StyleScope ALL = new StyleScope(true, true);

    public static StyleScope of(Node instance, boolean root) {
        ContentKind k = instance.content().kind();
        boolean text = k == ContentKind.TEXT || k == ContentKind.STYLED_TEXT;
        return new StyleScope(!root, text);
    }
}
