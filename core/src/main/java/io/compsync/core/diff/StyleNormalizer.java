// file: core/src/main/java/io/compsync/core/diff/StyleNormalizer.java
package io.compsync.core.diff;

import io.compsync.core.model.Insets;
import io.compsync.core.model.LayoutStyle;
import io.compsync.core.model.Paint;
import io.compsync.core.model.StyleBundle;
import io.compsync.core.model.TextStyle;
import io.compsync.core.model.VisualStyle;

import java.util.ArrayList;
import java.util.List;

/**
 * Brings a style bundle into canonical form before comparison.
 * <p>
 * Both sides of a diff go through the same normalization, so values that
 * only differ in representation compare equal:
 *  - missing groups, enums and padding become their defaults,
 *  - NaN becomes the field default (1.0 for paint opacity),
 *  - invisible or fully transparent paints are dropped, colors are clamped,
 *  - stroke width without any visible stroke becomes the default width,
 *  - opacity is clamped into [0, 1], negative corner radius becomes 0.
 */
final class StyleNormalizer {

    private StyleNormalizer() {}

    static StyleBundle normalize(StyleBundle s) {
        if (s == null) s = StyleBundle.DEFAULT;
        return new StyleBundle(layout(s.layout()), visual(s.visual()), text(s.text()));
    }

    static LayoutStyle layout(LayoutStyle l) {
        LayoutStyle d = LayoutStyle.DEFAULT;
        Insets p = l.padding() == null ? Insets.ZERO : new Insets(
                num(l.padding().top(), 0), num(l.padding().right(), 0),
                num(l.padding().bottom(), 0), num(l.padding().left(), 0));
        return new LayoutStyle(
                l.positioning() == null ? d.positioning() : l.positioning(),
                num(l.x(), 0),
                num(l.y(), 0),
                l.horizontalSizing() == null ? d.horizontalSizing() : l.horizontalSizing(),
                l.verticalSizing() == null ? d.verticalSizing() : l.verticalSizing(),
                num(l.width(), 0),
                num(l.height(), 0),
                l.layoutMode() == null ? d.layoutMode() : l.layoutMode(),
                p,
                num(l.itemSpacing(), 0)
        );
    }

    static VisualStyle visual(VisualStyle v) {
        List<Paint> fills = paints(v.fills());
        List<Paint> strokes = paints(v.strokes());
        double strokeWidth = strokes.isEmpty()
                ? VisualStyle.DEFAULT_STROKE_WIDTH
                : num(v.strokeWidth(), VisualStyle.DEFAULT_STROKE_WIDTH);
        return new VisualStyle(
                fills,
                strokes,
                strokeWidth,
                Math.max(0, num(v.cornerRadius(), 0)),
                clampUnit(num(v.opacity(), 1.0)),
                v.visible()
        );
    }

    static TextStyle text(TextStyle t) {
        TextStyle d = TextStyle.DEFAULT;
        if (t == null) return d;
        return new TextStyle(
                t.fontFamily() == null || t.fontFamily().isBlank() ? d.fontFamily() : t.fontFamily(),
                num(t.fontSize(), d.fontSize()),
                t.fontWeight() <= 0 ? d.fontWeight() : t.fontWeight(),
                t.color() == null ? d.color() : t.color().clamped(),
                num(t.lineHeight(), d.lineHeight()),
                num(t.letterSpacing(), d.letterSpacing()),
                t.align() == null ? d.align() : t.align()
        );
    }

    private static List<Paint> paints(List<Paint> in) {
        if (in == null || in.isEmpty()) return List.of();
        List<Paint> out = new ArrayList<>(in.size());
        for (Paint p : in) {
            if (p == null || p.invisible()) continue;
            out.add(new Paint(
                    p.type() == null ? Paint.Type.SOLID : p.type(),
                    p.color() == null ? null : p.color().clamped(),
                    clampUnit(num(p.opacity(), 1.0)),
                    true
            ));
        }
        return List.copyOf(out);
    }

    private static double num(double v, double dflt) {
        return Double.isNaN(v) ? dflt : v;
    }

    private static double clampUnit(double v) {
        return Math.max(0, Math.min(1, v));
    }
}
