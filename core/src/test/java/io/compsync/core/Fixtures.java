// file: core/src/test/java/io/compsync/core/Fixtures.java
package io.compsync.core;

import io.compsync.core.model.Color;
import io.compsync.core.model.ComponentRef;
import io.compsync.core.model.ContentPayload;
import io.compsync.core.model.Document;
import io.compsync.core.model.LayoutStyle;
import io.compsync.core.model.Node;
import io.compsync.core.model.StyleBundle;
import io.compsync.core.model.TextStyle;
import io.compsync.core.model.VisualStyle;

import java.util.List;

/**
 * Small builders for test trees.
 */
public final class Fixtures {

    public static final Color RED = Color.rgb(255, 0, 0);
    public static final Color BLUE = Color.rgb(0, 0, 255);
    public static final Color GREEN = Color.rgb(0, 200, 0);
    public static final Color GREY = Color.rgb(200, 200, 200);

    private Fixtures() {}

    public static StyleBundle box(double x, double y, double w, double h, Color fill) {
        return new StyleBundle(LayoutStyle.absolute(x, y, w, h), VisualStyle.filled(fill), null);
    }

    public static Node frame(String id, String name, StyleBundle style, Node... children) {
        return Node.builder(id, name).style(style).children(children).build();
    }

    public static Node text(String id, String name, String text, TextStyle style) {
        return Node.builder(id, name)
                .style(new StyleBundle(LayoutStyle.absolute(8, 8, 80, 16), VisualStyle.DEFAULT, style))
                .content(new ContentPayload.Text(text))
                .build();
    }

    /** Component definition: a button with a fill and a label. */
    public static Node button(String id, String name, String group, Color fill) {
        return Node.builder(id, name)
                .variantGroup(group)
                .style(box(0, 0, 120, 40, fill))
                .children(text(id + ":label", "Label", "OK", TextStyle.DEFAULT))
                .build();
    }

    /** Instance of a button component, same shape as {@link #button}. */
    public static Node buttonInstance(String id, String name, ComponentRef ref, Color fill) {
        return Node.builder(id, name)
                .style(box(300, 500, 120, 40, fill))
                .children(text(id + ":label", "Label", "OK", TextStyle.DEFAULT))
                .componentRef(ref)
                .build();
    }

    public static Document doc(String id, Node... topLevel) {
        return new Document(id, id, Node.builder(id + ":root", "Page").children(List.of(topLevel)).build());
    }
}
