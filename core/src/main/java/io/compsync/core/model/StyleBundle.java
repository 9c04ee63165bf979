// file: core/src/main/java/io/compsync/core/model/StyleBundle.java
package io.compsync.core.model;

/**
 * Visual and layout attributes of one node. Missing groups are replaced by
 * their defaults.
 */
public record StyleBundle(LayoutStyle layout, VisualStyle visual, TextStyle text) {

    public static final StyleBundle DEFAULT =
            new StyleBundle(LayoutStyle.DEFAULT, VisualStyle.DEFAULT, TextStyle.DEFAULT);

    public StyleBundle {
        if (layout == null) layout = LayoutStyle.DEFAULT;
        if (visual == null) visual = VisualStyle.DEFAULT;
        if (text == null) text = TextStyle.DEFAULT;
    }

    public StyleBundle withLayout(LayoutStyle l) { return new StyleBundle(l, visual, text); }

    public StyleBundle withVisual(VisualStyle v) { return new StyleBundle(layout, v, text); }

    public StyleBundle withText(TextStyle t) { return new StyleBundle(layout, visual, t); }
}
