// file: storage/src/test/java/io/compsync/storage/DocumentReaderTest.java
package io.compsync.storage;

import io.compsync.core.model.ContentPayload;
import io.compsync.core.model.Document;
import io.compsync.core.model.LayoutStyle;
import io.compsync.core.model.Node;
import io.compsync.core.model.Paint;
import io.compsync.core.model.VisualStyle;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class DocumentReaderTest {

    private final DocumentReader reader = new DocumentReader();

    static byte[] resource(String name) throws IOException {
        try (InputStream in = DocumentReaderTest.class.getResourceAsStream("/documents/" + name)) {
            assertNotNull(in, "missing test resource " + name);
            return in.readAllBytes();
        }
    }

    @Test
    void reads_library_fixture_into_node_tree() throws Exception {
        Document doc = reader.read(resource("library.json"));

        assertEquals("lib", doc.id());
        assertEquals("Core components", doc.name());
        assertEquals(3, doc.root().children().size());

        Node button = doc.root().children().get(0);
        assertEquals("lib:button", button.id());
        assertEquals("MyButton", button.name());
        assertFalse(button.isInstance());
        assertEquals(120, button.style().layout().width());
        assertEquals(LayoutStyle.Positioning.ABSOLUTE, button.style().layout().positioning());
        assertEquals(6, button.style().visual().cornerRadius());

        Paint fill = button.style().visual().fills().get(0);
        assertEquals(Paint.Type.SOLID, fill.type());
        assertEquals(0.2, fill.color().r());
        assertEquals(1.0, fill.color().a(), "alpha defaults to opaque");

        Node label = button.children().get(0);
        assertEquals(new ContentPayload.Text("OK"), label.content());
        assertEquals(600, label.style().text().fontWeight());
        assertEquals(VisualStyle.DEFAULT, label.style().visual());
    }

    @Test
    void variant_members_and_lowercase_enum_values() throws Exception {
        Document doc = reader.read(resource("library.json"));
        Node large = doc.root().children().get(2);

        assertEquals("Chip", large.variantGroup());
        assertEquals("Size=Large", large.name());
        var content = assertInstanceOf(ContentPayload.Container.class, large.content());
        assertTrue(content.clipsContent());
        assertTrue(content.fillsEnabled());
    }

    @Test
    void reads_instances_and_ignores_unknown_properties() throws Exception {
        Document doc = reader.read(resource("screen.json"));

        Node buy = doc.root().children().get(0);
        assertTrue(buy.isInstance());
        assertEquals("lib", buy.componentRef().documentId());
        assertEquals("lib:button", buy.componentRef().componentId());
        assertNull(buy.componentRef().componentSetName());

        Node hero = doc.root().children().get(1);
        var image = assertInstanceOf(ContentPayload.Image.class, hero.content());
        assertEquals("img-42", image.imageRef());
        assertEquals(ContentPayload.Image.ScaleMode.CROP, image.scaleMode());
    }

    @Test
    void missing_content_and_style_fall_back_to_defaults() {
        String json = """
                {"id": "d", "root": {"id": "r", "name": "Page"}}
                """;
        Document doc = reader.read(json.getBytes(StandardCharsets.UTF_8));

        assertEquals("d", doc.name(), "document name defaults to id");
        assertEquals(ContentPayload.Container.DEFAULT, doc.root().content());
        assertTrue(doc.root().children().isEmpty());
    }

    @Test
    void component_ref_without_document_points_at_the_owning_document() {
        String json = """
                {"id": "screen", "root": {"id": "r", "children": [
                  {"id": "local", "componentRef": {"componentId": "s-badge"}},
                  {"id": "remote", "componentRef": {"documentId": "lib", "componentId": "l-badge"}}
                ]}}
                """;
        Document doc = reader.read(json.getBytes(StandardCharsets.UTF_8));

        assertEquals("screen", doc.root().children().get(0).componentRef().documentId());
        assertEquals("lib", doc.root().children().get(1).componentRef().documentId());
    }

    @Test
    void rejects_invalid_json() {
        var ex = assertThrows(DocumentFormatException.class,
                () -> reader.read("{\"id\": ".getBytes(StandardCharsets.UTF_8)));
        assertTrue(ex.getMessage().startsWith("invalid JSON"));
    }

    @Test
    void rejects_node_without_id_and_reports_path() {
        String json = """
                {"id": "d", "root": {"id": "r", "children": [{"id": "a", "children": [{"name": "x"}]}]}}
                """;
        var ex = assertThrows(DocumentFormatException.class,
                () -> reader.read(json.getBytes(StandardCharsets.UTF_8)));
        assertTrue(ex.getMessage().contains("/r/a/"), ex.getMessage());
    }

    @Test
    void rejects_unknown_content_type() {
        String json = """
                {"id": "d", "root": {"id": "r", "content": {"type": "WIDGET"}}}
                """;
        var ex = assertThrows(DocumentFormatException.class,
                () -> reader.read(json.getBytes(StandardCharsets.UTF_8)));
        assertTrue(ex.getMessage().contains("WIDGET"));
    }

    @Test
    void rejects_component_ref_without_id_or_name() {
        String json = """
                {"id": "d", "root": {"id": "r", "componentRef": {"documentId": "lib"}}}
                """;
        assertThrows(DocumentFormatException.class,
                () -> reader.read(json.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void rejects_document_without_root() {
        assertThrows(DocumentFormatException.class,
                () -> reader.read("{\"id\": \"d\"}".getBytes(StandardCharsets.UTF_8)));
    }
}
