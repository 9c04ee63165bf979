// file: core/src/test/java/io/compsync/core/override/OverrideTreeWalkerTest.java
package io.compsync.core.override;

import io.compsync.core.diag.DiagnosticEvent;
import io.compsync.core.diag.OverrideDiagnostics;
import io.compsync.core.diag.RecordingDiagnostics;
import io.compsync.core.diff.ContentField;
import io.compsync.core.diff.DiffPolicy;
import io.compsync.core.diff.StyleField;
import io.compsync.core.index.NodeIndexer;
import io.compsync.core.index.ReferenceIndex;
import io.compsync.core.model.Color;
import io.compsync.core.model.ComponentRef;
import io.compsync.core.model.ContentPayload;
import io.compsync.core.model.Document;
import io.compsync.core.model.Node;
import io.compsync.core.model.Paint;
import io.compsync.core.model.TextStyle;
import io.compsync.core.resolve.IndexCatalog;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static io.compsync.core.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class OverrideTreeWalkerTest {

    private static ReferenceIndex index(Document d) {
        return new NodeIndexer(OverrideDiagnostics.NOOP).build(d);
    }

    private static OverrideTreeWalker walker(IndexCatalog catalog, OverrideDiagnostics diag) {
        return OverrideTreeWalker.create(DiffPolicy.DEFAULT, catalog, diag);
    }

    private static Color fillOf(OverrideEntry e) {
        @SuppressWarnings("unchecked")
        List<Paint> fills = (List<Paint>) e.style().value(StyleField.FILLS);
        return fills.get(0).color();
    }

    /** Card component whose two nested buttons carry a library-side label text. */
    private static Document cardLibrary() {
        Node button = button("c-btn", "Button", null, GREY);
        Node card = frame("c-card", "Card", box(0, 0, 300, 120, Color.rgb(255, 255, 255)),
                nestedButton("c-card:p", "Primary", GREY, "Card label"),
                nestedButton("c-card:s", "Secondary", GREY, "Card label"));
        return doc("lib", button, card);
    }

    private static Node nestedButton(String id, String name, Color fill, String label) {
        return Node.builder(id, name)
                .style(box(0, 0, 120, 40, fill))
                .children(text(id + ":label", "Label", label, TextStyle.DEFAULT))
                .componentRef(new ComponentRef("lib", "c-btn", "Button", null))
                .build();
    }

    @Test
    void plain_component_with_fill_change_yields_single_root_entry() {
        ReferenceIndex lib = index(doc("lib", button("c-mybtn", "MyButton", null, GREY)));
        Node inst = buttonInstance("i-1", "MyButton", new ComponentRef("lib", "c-mybtn", "MyButton", null), RED);

        OverrideMap map = walker(IndexCatalog.empty(), OverrideDiagnostics.NOOP).computeOverrides(inst, lib);

        assertEquals(Set.of("MyButton"), map.keys());
        OverrideEntry e = map.get("MyButton").orElseThrow();
        assertTrue(e.hasStyle());
        assertFalse(e.hasContent());
        assertEquals(Set.of(StyleField.FILLS), e.style().fields());
        assertEquals(RED, fillOf(e));
    }

    @Test
    void unresolved_reference_yields_empty_map() {
        ReferenceIndex lib = index(doc("lib", button("c-mybtn", "MyButton", null, GREY)));
        Node inst = buttonInstance("i-1", "Ghost", new ComponentRef("lib", "nope", "Ghost", null), RED);
        var diag = new RecordingDiagnostics();

        OverrideMap map = assertDoesNotThrow(() -> walker(IndexCatalog.empty(), diag).computeOverrides(inst, lib));

        assertTrue(map.isEmpty());
        assertEquals(1, diag.eventsOf(DiagnosticEvent.ResolutionFailed.class).size());
        assertTrue(diag.eventsOf(DiagnosticEvent.DiffFound.class).isEmpty(), "no descent without a reference");
    }

    @Test
    void non_instance_root_yields_empty_map() {
        ReferenceIndex lib = index(doc("lib", button("c-mybtn", "MyButton", null, GREY)));
        OverrideMap map = walker(IndexCatalog.empty(), OverrideDiagnostics.NOOP)
                .computeOverrides(button("x", "MyButton", null, RED), lib);
        assertTrue(map.isEmpty());
    }

    @Test
    void identical_instance_yields_empty_map() {
        ReferenceIndex lib = index(doc("lib", button("c-mybtn", "MyButton", null, GREY)));
        Node inst = buttonInstance("i-1", "MyButton", new ComponentRef("lib", "c-mybtn", "MyButton", null), GREY);
        var diag = new RecordingDiagnostics();

        assertTrue(walker(IndexCatalog.empty(), diag).computeOverrides(inst, lib).isEmpty());
        // root and label were both compared and suppressed
        assertEquals(2, diag.eventsOf(DiagnosticEvent.DiffSuppressed.class).size());
    }

    @Test
    void computing_twice_gives_identical_maps() {
        ReferenceIndex lib = index(cardLibrary());
        Node inst = cardInstance();
        var w = walker(IndexCatalog.empty(), OverrideDiagnostics.NOOP);

        OverrideMap first = w.computeOverrides(inst, lib);
        OverrideMap second = w.computeOverrides(inst, lib);

        assertEquals(first, second);
        assertEquals(new ArrayList<>(first.keys()), new ArrayList<>(second.keys()));
    }

    private static Node cardInstance() {
        return Node.builder("i-card", "Card")
                .style(box(40, 40, 300, 120, Color.rgb(255, 255, 255)))
                .componentRef(new ComponentRef("lib", "c-card", "Card", null))
                .children(
                        buttonInstance("i-card:p", "Primary", new ComponentRef("lib", "c-btn", "Button", null), RED),
                        buttonInstance("i-card:s", "Secondary", new ComponentRef("lib", "c-btn", "Button", null), BLUE))
                .build();
    }

    @Test
    void nested_instances_are_resolved_against_their_own_component() {
        ReferenceIndex lib = index(cardLibrary());
        var diag = new RecordingDiagnostics();

        OverrideMap map = walker(IndexCatalog.empty(), diag).computeOverrides(cardInstance(), lib);

        // Labels say "OK" like the Button component; comparing them with the
        // card's "Card label" children would produce a bogus "Label" entry.
        assertEquals(List.of("Primary", "Secondary"), new ArrayList<>(map.keys()));
        OverrideEntry primary = map.get("Primary").orElseThrow();
        OverrideEntry secondary = map.get("Secondary").orElseThrow();
        assertEquals(Set.of(StyleField.FILLS), primary.style().fields());
        assertEquals(Set.of(StyleField.FILLS), secondary.style().fields());
        assertEquals(RED, fillOf(primary));
        assertEquals(BLUE, fillOf(secondary));
        assertFalse(primary.hasContent());

        long buttonResolutions = diag.eventsOf(DiagnosticEvent.ResolutionSucceeded.class).stream()
                .filter(e -> e.referenceId().equals("c-btn"))
                .count();
        assertEquals(2, buttonResolutions);
    }

    @Test
    void selected_variant_is_the_reference_and_not_an_override() {
        ReferenceIndex lib = index(doc("lib",
                button("b-def", "state=default", "Button", GREY),
                button("b-hov", "state=hover", "Button", BLUE)));
        Node hover = buttonInstance("i-1", "state=hover",
                new ComponentRef("lib", "b-hov", "state=hover", "Button"), BLUE);
        var diag = new RecordingDiagnostics();

        OverrideMap map = walker(IndexCatalog.empty(), diag).computeOverrides(hover, lib);

        assertTrue(map.isEmpty(), "picking the hover variant is not an override");
        assertEquals("b-hov", diag.eventsOf(DiagnosticEvent.ResolutionSucceeded.class).get(0).referenceId());
    }

    @Test
    void variant_root_entry_is_keyed_by_component_set() {
        ReferenceIndex lib = index(doc("lib",
                button("b-def", "state=default", "Button", GREY),
                button("b-hov", "state=hover", "Button", BLUE)));
        Node hoverRed = buttonInstance("i-1", "state=hover",
                new ComponentRef("lib", null, "state=hover", "Button"), RED);

        OverrideMap map = walker(IndexCatalog.empty(), OverrideDiagnostics.NOOP).computeOverrides(hoverRed, lib);

        assertEquals(Set.of("Button"), map.keys());
        // diffed against hover (BLUE), not the default variant (GREY)
        assertEquals(RED, fillOf(map.get("Button").orElseThrow()));
    }

    @Test
    void text_change_in_descendant_is_keyed_by_descendant_name() {
        ReferenceIndex lib = index(doc("lib", button("c-mybtn", "MyButton", null, GREY)));
        Node inst = Node.builder("i-1", "MyButton")
                .style(box(0, 0, 120, 40, GREY))
                .componentRef(new ComponentRef("lib", "c-mybtn", "MyButton", null))
                .children(text("i-1:label", "Label", "Buy now", TextStyle.DEFAULT))
                .build();

        OverrideMap map = walker(IndexCatalog.empty(), OverrideDiagnostics.NOOP).computeOverrides(inst, lib);

        assertEquals(Set.of("Label"), map.keys());
        OverrideEntry e = map.get("Label").orElseThrow();
        assertFalse(e.hasStyle());
        assertEquals("Buy now", e.content().value(ContentField.TEXT));
    }

    @Test
    void same_named_siblings_are_keyed_by_position() {
        Node comp = frame("c", "Pair", box(0, 0, 100, 100, GREY),
                text("c:1", "Label", "one", TextStyle.DEFAULT),
                text("c:2", "Label", "two", TextStyle.DEFAULT));
        ReferenceIndex lib = index(doc("lib", comp));
        Node inst = Node.builder("i", "Pair")
                .style(box(0, 0, 100, 100, GREY))
                .componentRef(new ComponentRef("lib", "c", "Pair", null))
                .children(
                        text("i:1", "Label", "uno", TextStyle.DEFAULT),
                        text("i:2", "Label", "dos", TextStyle.DEFAULT))
                .build();
        var diag = new RecordingDiagnostics();

        OverrideMap map = walker(IndexCatalog.empty(), diag).computeOverrides(inst, lib);

        assertEquals(List.of("Label", "Label#1"), new ArrayList<>(map.keys()));
        assertEquals("uno", map.get("Label").orElseThrow().content().value(ContentField.TEXT));
        assertEquals("dos", map.get("Label#1").orElseThrow().content().value(ContentField.TEXT));
        assertTrue(diag.eventsOf(DiagnosticEvent.KeyCollision.class).isEmpty());
    }

    @Test
    void same_named_nested_instances_each_keep_their_override() {
        Node button = button("c-btn", "Button", null, GREY);
        Node card = frame("c-card", "Card", box(0, 0, 300, 120, Color.rgb(255, 255, 255)),
                nestedButton("c-card:a", "Button", GREY, "OK"),
                nestedButton("c-card:b", "Button", GREY, "OK"));
        ReferenceIndex lib = index(doc("lib", button, card));
        Node inst = Node.builder("i-card", "Card")
                .style(box(40, 40, 300, 120, Color.rgb(255, 255, 255)))
                .componentRef(new ComponentRef("lib", "c-card", "Card", null))
                .children(
                        buttonInstance("i-card:a", "Button", new ComponentRef("lib", "c-btn", "Button", null), RED),
                        buttonInstance("i-card:b", "Button", new ComponentRef("lib", "c-btn", "Button", null), BLUE))
                .build();
        var diag = new RecordingDiagnostics();

        OverrideMap map = walker(IndexCatalog.empty(), diag).computeOverrides(inst, lib);

        assertEquals(2, map.size());
        assertEquals(List.of("Button", "Button#1"), new ArrayList<>(map.keys()));
        OverrideEntry first = map.get("Button").orElseThrow();
        OverrideEntry second = map.get("Button#1").orElseThrow();
        assertEquals(Set.of(StyleField.FILLS), first.style().fields());
        assertEquals(Set.of(StyleField.FILLS), second.style().fields());
        assertFalse(first.hasContent());
        assertFalse(second.hasContent());
        assertEquals(RED, fillOf(first));
        assertEquals(BLUE, fillOf(second));
        assertTrue(diag.eventsOf(DiagnosticEvent.KeyCollision.class).isEmpty());
    }

    @Test
    void key_collision_keeps_first_occurrence() {
        Node comp = frame("c", "Pair", box(0, 0, 200, 100, GREY),
                frame("c:l", "Left", box(0, 0, 100, 100, GREY), text("c:l:t", "Label", "one", TextStyle.DEFAULT)),
                frame("c:r", "Right", box(100, 0, 100, 100, GREY), text("c:r:t", "Label", "two", TextStyle.DEFAULT)));
        ReferenceIndex lib = index(doc("lib", comp));
        Node inst = Node.builder("i", "Pair")
                .style(box(0, 0, 200, 100, GREY))
                .componentRef(new ComponentRef("lib", "c", "Pair", null))
                .children(
                        frame("i:l", "Left", box(0, 0, 100, 100, GREY), text("i:l:t", "Label", "uno", TextStyle.DEFAULT)),
                        frame("i:r", "Right", box(100, 0, 100, 100, GREY), text("i:r:t", "Label", "dos", TextStyle.DEFAULT)))
                .build();
        var diag = new RecordingDiagnostics();

        OverrideMap map = walker(IndexCatalog.empty(), diag).computeOverrides(inst, lib);

        assertEquals(1, map.size());
        assertEquals("uno", map.get("Label").orElseThrow().content().value(ContentField.TEXT));
        var collisions = diag.eventsOf(DiagnosticEvent.KeyCollision.class);
        assertEquals(1, collisions.size());
        assertEquals("i:l:t", collisions.get(0).keptNodeId());
        assertEquals("i:r:t", collisions.get(0).droppedNodeId());
    }

    @Test
    void nested_instance_without_document_resolves_in_the_instance_document() {
        ReferenceIndex lib = index(doc("lib",
                button("l-badge", "Badge", null, GREY),
                frame("c-card", "Card", box(0, 0, 300, 120, Color.rgb(255, 255, 255)),
                        buttonInstance("c-card:slot", "Slot", new ComponentRef("lib", "l-badge", "Badge", null), GREY))));
        ReferenceIndex screen = index(doc("screen", button("s-badge", "Badge", null, RED)));
        Node inst = Node.builder("i-card", "Card")
                .style(box(40, 40, 300, 120, Color.rgb(255, 255, 255)))
                .componentRef(new ComponentRef("lib", "c-card", "Card", null))
                .children(buttonInstance("i-card:slot", "Slot", new ComponentRef(null, "s-badge", "Badge", null), RED))
                .build();
        var diag = new RecordingDiagnostics();

        OverrideMap map = walker(IndexCatalog.of(lib, screen), diag).computeOverrides(inst, lib, "screen");

        assertTrue(map.isEmpty(), "the screen-local RED badge is the reference, not an override");
        assertEquals("s-badge", diag.eventsOf(DiagnosticEvent.ResolutionSucceeded.class).stream()
                .filter(e -> e.instanceId().equals("i-card:slot"))
                .findFirst().orElseThrow().referenceId());
    }

    @Test
    void nested_instance_from_another_library_uses_that_library_index() {
        ReferenceIndex core = index(doc("lib-core", button("c-btn", "Button", null, GREY)));
        Node toolbar = frame("c-bar", "Toolbar", box(0, 0, 400, 48, GREY),
                Node.builder("c-bar:ok", "Ok")
                        .style(box(0, 0, 120, 40, GREY))
                        .componentRef(new ComponentRef("lib-core", "c-btn", "Button", null))
                        .children(text("c-bar:ok:label", "Label", "OK", TextStyle.DEFAULT))
                        .build());
        ReferenceIndex bars = index(doc("lib-bars", toolbar));

        Node inst = Node.builder("i-bar", "Toolbar")
                .style(box(0, 0, 400, 48, GREY))
                .componentRef(new ComponentRef("lib-bars", "c-bar", "Toolbar", null))
                .children(buttonInstance("i-bar:ok", "Ok", new ComponentRef("lib-core", "c-btn", "Button", null), RED))
                .build();

        OverrideMap loaded = walker(IndexCatalog.of(core, bars), OverrideDiagnostics.NOOP).computeOverrides(inst, bars);
        assertEquals(Set.of("Ok"), loaded.keys());

        var diag = new RecordingDiagnostics();
        OverrideMap missing = walker(IndexCatalog.of(bars), diag).computeOverrides(inst, bars);
        assertTrue(missing.isEmpty());
        var failed = diag.eventsOf(DiagnosticEvent.ResolutionFailed.class);
        assertEquals(1, failed.size());
        assertEquals("lib-core", failed.get(0).documentId());
    }

    @Test
    void unresolved_nested_instance_does_not_affect_siblings() {
        ReferenceIndex lib = index(cardLibrary());
        Node inst = Node.builder("i-card", "Card")
                .style(box(40, 40, 300, 120, Color.rgb(255, 255, 255)))
                .componentRef(new ComponentRef("lib", "c-card", "Card", null))
                .children(
                        buttonInstance("i-card:p", "Primary", new ComponentRef("lib", "gone", "Gone", null), RED),
                        buttonInstance("i-card:s", "Secondary", new ComponentRef("lib", "c-btn", "Button", null), BLUE))
                .build();

        OverrideMap map = walker(IndexCatalog.empty(), OverrideDiagnostics.NOOP).computeOverrides(inst, lib);

        assertEquals(Set.of("Secondary"), map.keys());
    }

    @Test
    void extra_instance_child_is_reported_and_skipped() {
        ReferenceIndex lib = index(doc("lib", frame("c", "Empty", box(0, 0, 10, 10, GREY))));
        Node inst = Node.builder("i", "Empty")
                .style(box(0, 0, 10, 10, GREY))
                .componentRef(new ComponentRef("lib", "c", "Empty", null))
                .children(text("i:x", "Extra", "?", TextStyle.DEFAULT))
                .build();
        var diag = new RecordingDiagnostics();

        assertTrue(walker(IndexCatalog.empty(), diag).computeOverrides(inst, lib).isEmpty());
        assertEquals("i:x", diag.eventsOf(DiagnosticEvent.UnmatchedDescendant.class).get(0).nodeId());
    }

    @Test
    void container_flag_and_style_land_in_one_entry() {
        ReferenceIndex lib = index(doc("lib", button("c-mybtn", "MyButton", null, GREY)));
        Node inst = buttonInstance("i-1", "MyButton", new ComponentRef("lib", "c-mybtn", "MyButton", null), RED)
                .toBuilder()
                .content(new ContentPayload.Container(true, true, true, true))
                .build();

        OverrideEntry e = walker(IndexCatalog.empty(), OverrideDiagnostics.NOOP)
                .computeOverrides(inst, lib).get("MyButton").orElseThrow();

        assertTrue(e.hasStyle());
        assertTrue(e.hasContent());
        assertEquals(Set.of(ContentField.CLIPS_CONTENT), e.content().fields());
    }

    @Test
    void parallel_computations_match_sequential_result() throws Exception {
        ReferenceIndex lib = index(cardLibrary());
        Node inst = cardInstance();
        var w = walker(IndexCatalog.empty(), OverrideDiagnostics.NOOP);
        OverrideMap expected = w.computeOverrides(inst, lib);

        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<OverrideMap>> futures = new ArrayList<>();
            for (int i = 0; i < 32; i++) {
                futures.add(pool.submit(() -> w.computeOverrides(inst, lib)));
            }
            for (Future<OverrideMap> f : futures) {
                assertEquals(expected, f.get());
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void disabled_diagnostics_do_not_change_results() {
        ReferenceIndex lib = index(cardLibrary());
        OverrideMap quiet = walker(IndexCatalog.empty(), OverrideDiagnostics.NOOP).computeOverrides(cardInstance(), lib);
        OverrideMap loud = walker(IndexCatalog.empty(), new RecordingDiagnostics()).computeOverrides(cardInstance(), lib);
        assertEquals(quiet, loud);
    }
}
