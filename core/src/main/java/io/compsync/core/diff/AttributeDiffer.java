// file: core/src/main/java/io/compsync/core/diff/AttributeDiffer.java
package io.compsync.core.diff;

import io.compsync.core.model.Color;
import io.compsync.core.model.ContentPayload;
import io.compsync.core.model.Insets;
import io.compsync.core.model.LayoutStyle;
import io.compsync.core.model.Paint;
import io.compsync.core.model.StyleBundle;
import io.compsync.core.model.TextRun;
import io.compsync.core.model.TextStyle;
import io.compsync.core.model.VisualStyle;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Field-by-field comparison of an instance node against its reference node.
 * <p>
 * Policy:
 *  - both sides are normalized identically (see {@link StyleNormalizer}),
 *  - numbers compare with {@link DiffPolicy#epsilon()}, colors and opacities
 *    with {@link DiffPolicy#colorEpsilon()},
 *  - x / y only count when the instance is absolutely positioned, width /
 *    height only when the instance has a fixed size on that axis; flow layout
 *    values are computed, not authored,
 *  - an empty result is Optional.empty(), never an empty delta.
 * Stateless and thread safe.
 */
public final class AttributeDiffer {

    private final DiffPolicy policy;

    public AttributeDiffer(DiffPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    public DiffPolicy policy() {
        return policy;
    }

    /** Compare every style field. */
    public Optional<StyleDelta> diffStyle(StyleBundle instance, StyleBundle reference) {
        return diffStyle(instance, reference, StyleScope.ALL);
    }

    public Optional<StyleDelta> diffStyle(StyleBundle instance, StyleBundle reference, StyleScope scope) {
        StyleBundle a = StyleNormalizer.normalize(instance);
        StyleBundle b = StyleNormalizer.normalize(reference);
        Map<StyleField, Object> out = new EnumMap<>(StyleField.class);

        diffLayout(a.layout(), b.layout(), scope, out);
        diffVisual(a.visual(), b.visual(), out);
        if (scope.typography()) {
            diffText(a.text(), b.text(), out);
        }
        return out.isEmpty() ? Optional.empty() : Optional.of(new StyleDelta(out));
    }

    public Optional<ContentDelta> diffContent(ContentPayload instance, ContentPayload reference) {
        Objects.requireNonNull(instance, "instance");
        Objects.requireNonNull(reference, "reference");

        if (instance.kind() != reference.kind()) {
            return Optional.of(new ContentDelta(instance.kind(), allFields(instance), true));
        }

        Map<ContentField, Object> out = new EnumMap<>(ContentField.class);
        if (instance instanceof ContentPayload.Container a && reference instanceof ContentPayload.Container b) {
            flag(ContentField.CLIPS_CONTENT, a.clipsContent(), b.clipsContent(), out);
            flag(ContentField.FILLS_ENABLED, a.fillsEnabled(), b.fillsEnabled(), out);
            flag(ContentField.STROKES_ENABLED, a.strokesEnabled(), b.strokesEnabled(), out);
            flag(ContentField.EFFECTS_ENABLED, a.effectsEnabled(), b.effectsEnabled(), out);
        } else if (instance instanceof ContentPayload.Text a && reference instanceof ContentPayload.Text b) {
            if (!a.text().equals(b.text())) out.put(ContentField.TEXT, a.text());
        } else if (instance instanceof ContentPayload.StyledText a && reference instanceof ContentPayload.StyledText b) {
            List<TextRun> ra = normalizeRuns(a.runs());
            if (!sameRuns(ra, normalizeRuns(b.runs()))) out.put(ContentField.RUNS, ra);
        } else if (instance instanceof ContentPayload.Image a && reference instanceof ContentPayload.Image b) {
            if (!Objects.equals(a.imageRef(), b.imageRef())) out.put(ContentField.IMAGE_REF, a.imageRef());
            if (a.scaleMode() != b.scaleMode()) out.put(ContentField.SCALE_MODE, a.scaleMode());
        } else if (instance instanceof ContentPayload.Other a && reference instanceof ContentPayload.Other b) {
            if (!Objects.equals(a.type(), b.type())) out.put(ContentField.OTHER_TYPE, a.type());
        }
        // Vector: geometry is not diffed.

        return out.isEmpty() ? Optional.empty() : Optional.of(new ContentDelta(instance.kind(), out, false));
    }

    // ---------------- style groups ----------------

    private void diffLayout(LayoutStyle a, LayoutStyle b, StyleScope scope, Map<StyleField, Object> out) {
        enumField(StyleField.POSITIONING, a.positioning(), b.positioning(), out);
        if (scope.placement() && a.positioning() == LayoutStyle.Positioning.ABSOLUTE) {
            number(StyleField.X, a.x(), b.x(), out);
            number(StyleField.Y, a.y(), b.y(), out);
        }
        enumField(StyleField.HORIZONTAL_SIZING, a.horizontalSizing(), b.horizontalSizing(), out);
        enumField(StyleField.VERTICAL_SIZING, a.verticalSizing(), b.verticalSizing(), out);
        if (a.horizontalSizing() == LayoutStyle.Sizing.FIXED) {
            number(StyleField.WIDTH, a.width(), b.width(), out);
        }
        if (a.verticalSizing() == LayoutStyle.Sizing.FIXED) {
            number(StyleField.HEIGHT, a.height(), b.height(), out);
        }
        enumField(StyleField.LAYOUT_MODE, a.layoutMode(), b.layoutMode(), out);
        if (!sameInsets(a.padding(), b.padding())) out.put(StyleField.PADDING, a.padding());
        number(StyleField.ITEM_SPACING, a.itemSpacing(), b.itemSpacing(), out);
    }

    private void diffVisual(VisualStyle a, VisualStyle b, Map<StyleField, Object> out) {
        if (!samePaints(a.fills(), b.fills())) out.put(StyleField.FILLS, a.fills());
        if (!samePaints(a.strokes(), b.strokes())) out.put(StyleField.STROKES, a.strokes());
        number(StyleField.STROKE_WIDTH, a.strokeWidth(), b.strokeWidth(), out);
        number(StyleField.CORNER_RADIUS, a.cornerRadius(), b.cornerRadius(), out);
        if (!policy.nearUnit(a.opacity(), b.opacity())) out.put(StyleField.OPACITY, a.opacity());
        if (a.visible() != b.visible()) out.put(StyleField.VISIBLE, a.visible());
    }

    private void diffText(TextStyle a, TextStyle b, Map<StyleField, Object> out) {
        if (!a.fontFamily().equals(b.fontFamily())) out.put(StyleField.FONT_FAMILY, a.fontFamily());
        number(StyleField.FONT_SIZE, a.fontSize(), b.fontSize(), out);
        if (a.fontWeight() != b.fontWeight()) out.put(StyleField.FONT_WEIGHT, a.fontWeight());
        if (!sameColor(a.color(), b.color())) out.put(StyleField.TEXT_COLOR, a.color());
        number(StyleField.LINE_HEIGHT, a.lineHeight(), b.lineHeight(), out);
        number(StyleField.LETTER_SPACING, a.letterSpacing(), b.letterSpacing(), out);
        enumField(StyleField.TEXT_ALIGN, a.align(), b.align(), out);
    }

    // ---------------- comparisons ----------------

    boolean sameTextStyle(TextStyle a, TextStyle b) {
        Map<StyleField, Object> scratch = new EnumMap<>(StyleField.class);
        diffText(a, b, scratch);
        return scratch.isEmpty();
    }

    private boolean sameRuns(List<TextRun> a, List<TextRun> b) {
        if (a.size() != b.size()) return false;
        for (int i = 0; i < a.size(); i++) {
            TextRun x = a.get(i), y = b.get(i);
            if (!x.text().equals(y.text())) return false;
            if (!sameTextStyle(x.style(), y.style())) return false;
        }
        return true;
    }

    private static List<TextRun> normalizeRuns(List<TextRun> runs) {
        return runs.stream()
                .filter(r -> !r.text().isEmpty())
                .map(r -> new TextRun(r.text(), StyleNormalizer.text(r.style())))
                .toList();
    }

    private boolean samePaints(List<Paint> a, List<Paint> b) {
        if (a.size() != b.size()) return false;
        for (int i = 0; i < a.size(); i++) {
            Paint x = a.get(i), y = b.get(i);
            if (x.type() != y.type()) return false;
            if (!policy.nearUnit(x.opacity(), y.opacity())) return false;
            if (!sameColor(x.color(), y.color())) return false;
        }
        return true;
    }

    private boolean sameColor(Color a, Color b) {
        if (a == null || b == null) return a == b;
        return policy.nearUnit(a.r(), b.r())
                && policy.nearUnit(a.g(), b.g())
                && policy.nearUnit(a.b(), b.b())
                && policy.nearUnit(a.a(), b.a());
    }

    private boolean sameInsets(Insets a, Insets b) {
        return policy.near(a.top(), b.top())
                && policy.near(a.right(), b.right())
                && policy.near(a.bottom(), b.bottom())
                && policy.near(a.left(), b.left());
    }

    private void number(StyleField f, double a, double b, Map<StyleField, Object> out) {
        if (!policy.near(a, b)) out.put(f, a);
    }

    private static void enumField(StyleField f, Enum<?> a, Enum<?> b, Map<StyleField, Object> out) {
        if (a != b) out.put(f, a);
    }

    private static void flag(ContentField f, boolean a, boolean b, Map<ContentField, Object> out) {
        if (a != b) out.put(f, a);
    }

    /** Every non-null field of a payload, used when the content kind itself changed. */
    static Map<ContentField, Object> allFields(ContentPayload p) {
        Map<ContentField, Object> out = new EnumMap<>(ContentField.class);
        if (p instanceof ContentPayload.Container c) {
            out.put(ContentField.CLIPS_CONTENT, c.clipsContent());
            out.put(ContentField.FILLS_ENABLED, c.fillsEnabled());
            out.put(ContentField.STROKES_ENABLED, c.strokesEnabled());
            out.put(ContentField.EFFECTS_ENABLED, c.effectsEnabled());
        } else if (p instanceof ContentPayload.Text t) {
            out.put(ContentField.TEXT, t.text());
        } else if (p instanceof ContentPayload.StyledText s) {
            out.put(ContentField.RUNS, normalizeRuns(s.runs()));
        } else if (p instanceof ContentPayload.Image i) {
            if (i.imageRef() != null) out.put(ContentField.IMAGE_REF, i.imageRef());
            if (i.scaleMode() != null) out.put(ContentField.SCALE_MODE, i.scaleMode());
        } else if (p instanceof ContentPayload.Vector v) {
            if (v.geometryRef() != null) out.put(ContentField.GEOMETRY_REF, v.geometryRef());
        } else if (p instanceof ContentPayload.Other o) {
            if (o.type() != null) out.put(ContentField.OTHER_TYPE, o.type());
        }
        return out;
    }
}
