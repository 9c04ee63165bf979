// file: storage/src/main/java/io/compsync/storage/OverrideRecordCodec.java
package io.compsync.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.compsync.core.diff.ContentDelta;
import io.compsync.core.diff.ContentField;
import io.compsync.core.diff.StyleDelta;
import io.compsync.core.diff.StyleField;
import io.compsync.core.model.Color;
import io.compsync.core.model.ContentKind;
import io.compsync.core.model.ContentPayload;
import io.compsync.core.model.Insets;
import io.compsync.core.model.LayoutStyle;
import io.compsync.core.model.Paint;
import io.compsync.core.model.TextRun;
import io.compsync.core.model.TextStyle;
import io.compsync.core.override.OverrideEntry;
import io.compsync.core.override.OverrideMap;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.CRC32;

/**
 * Binary framing for computed override maps.
 * <p>
 * Layout:
 * <p>
 *   [HEADER (11 bytes, little-endian)]
 *     - magic   (2B)  = 0xC5D1
 *     - version (1B)  = 1
 *     - length  (4B)  = payload length in bytes
 *     - crc32   (4B)  = CRC32(payload)
 * <p>
 *   [PAYLOAD (length bytes)]
 *     UTF-8 JSON:
 *       { "entries": [
 *           { "key": "MyButton",
 *             "style":   { "FILLS": [ ... ], "OPACITY": 0.5 },
 *             "content": { "kind": "TEXT", "replaced": false, "changes": { "TEXT": "Buy" } } } ] }
 * <p>
 * Entry order and field order are preserved, so encoding the same map twice
 * yields identical bytes.
 */
public final class OverrideRecordCodec {
    static final short MAGIC = (short) 0xC5D1;
    static final byte VERSION = 1;
    static final int HEADER_BYTES = 2 + 1 + 4 + 4;

    private final ObjectMapper json = new ObjectMapper();

    /** Encode an override map into header+payload bytes. */
    public byte[] encode(OverrideMap overrides) {
        byte[] payload = encodePayload(overrides);
        ByteBuffer out = ByteBuffer.allocate(HEADER_BYTES + payload.length).order(ByteOrder.LITTLE_ENDIAN);
        out.putShort(MAGIC).put(VERSION).putInt(payload.length).putInt(crc32(payload));
        out.put(payload);
        return out.array();
    }

    /** Validate the header and decode the payload of a full record. */
    public OverrideMap decode(byte[] record) {
        if (record == null || record.length < HEADER_BYTES) {
            throw new CorruptRecordException("record shorter than header");
        }
        ByteBuffer b = ByteBuffer.wrap(record).order(ByteOrder.LITTLE_ENDIAN);
        short magic = b.getShort();
        byte version = b.get();
        int length = b.getInt();
        int crc = b.getInt();
        if (magic != MAGIC) throw new CorruptRecordException("bad magic: " + Integer.toHexString(magic & 0xFFFF));
        if (version != VERSION) throw new CorruptRecordException("unsupported version: " + version);
        if (length < 0 || length != b.remaining()) {
            throw new CorruptRecordException("length mismatch: header=" + length + " actual=" + b.remaining());
        }
        byte[] payload = new byte[length];
        b.get(payload);
        if (crc32(payload) != crc) throw new CorruptRecordException("crc mismatch");
        return decodePayload(payload);
    }

    // ----------------- payload -----------------

    private byte[] encodePayload(OverrideMap overrides) {
        ObjectNode root = json.createObjectNode();
        ArrayNode entries = root.putArray("entries");
        for (Map.Entry<String, OverrideEntry> e : overrides.asMap().entrySet()) {
            ObjectNode entry = entries.addObject();
            entry.put("key", e.getKey());
            OverrideEntry oe = e.getValue();
            if (oe.hasStyle()) {
                ObjectNode style = entry.putObject("style");
                for (Map.Entry<StyleField, Object> c : oe.style().changes().entrySet()) {
                    style.set(c.getKey().name(), json.valueToTree(c.getValue()));
                }
            }
            if (oe.hasContent()) {
                ContentDelta cd = oe.content();
                ObjectNode content = entry.putObject("content");
                content.put("kind", cd.kind().name());
                content.put("replaced", cd.replaced());
                ObjectNode changes = content.putObject("changes");
                for (Map.Entry<ContentField, Object> c : cd.changes().entrySet()) {
                    changes.set(c.getKey().name(), json.valueToTree(c.getValue()));
                }
            }
        }
        try {
            return json.writeValueAsBytes(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot serialize overrides", e);
        }
    }

    private OverrideMap decodePayload(byte[] payload) {
        try {
            JsonNode root = json.readTree(payload);
            JsonNode entries = root == null ? null : root.get("entries");
            if (entries == null || !entries.isArray()) {
                throw new CorruptRecordException("payload has no entries array");
            }
            Map<String, OverrideEntry> out = new LinkedHashMap<>();
            for (JsonNode entry : entries) {
                String key = entry.path("key").asText(null);
                if (key == null) throw new CorruptRecordException("entry without key");
                if (out.containsKey(key)) throw new CorruptRecordException("duplicate key: " + key);
                out.put(key, new OverrideEntry(readStyle(entry.get("style")), readContent(entry.get("content"))));
            }
            return OverrideMap.of(out);
        } catch (CorruptRecordException e) {
            throw e;
        } catch (Exception e) {
            // jackson failures and model validation failures alike mean the payload is unusable
            throw new CorruptRecordException("undecodable payload: " + e.getMessage(), e);
        }
    }

    private StyleDelta readStyle(JsonNode node) throws JsonProcessingException {
        if (node == null || node.isNull()) return null;
        Map<StyleField, Object> changes = new EnumMap<>(StyleField.class);
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> f = it.next();
            StyleField field = StyleField.valueOf(f.getKey());
            changes.put(field, json.treeToValue(f.getValue(), typeOf(field)));
        }
        return new StyleDelta(changes);
    }

    private ContentDelta readContent(JsonNode node) throws JsonProcessingException {
        if (node == null || node.isNull()) return null;
        ContentKind kind = ContentKind.valueOf(node.path("kind").asText());
        boolean replaced = node.path("replaced").asBoolean(false);
        Map<ContentField, Object> changes = new EnumMap<>(ContentField.class);
        JsonNode fields = node.get("changes");
        if (fields != null) {
            Iterator<Map.Entry<String, JsonNode>> it = fields.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> f = it.next();
                ContentField field = ContentField.valueOf(f.getKey());
                changes.put(field, json.treeToValue(f.getValue(), typeOf(field)));
            }
        }
        return new ContentDelta(kind, changes, replaced);
    }

    private JavaType typeOf(StyleField field) {
        return switch (field) {
            case X, Y, WIDTH, HEIGHT, ITEM_SPACING, STROKE_WIDTH, CORNER_RADIUS,
                 OPACITY, FONT_SIZE, LINE_HEIGHT, LETTER_SPACING -> type(Double.class);
            case VISIBLE -> type(Boolean.class);
            case FONT_WEIGHT -> type(Integer.class);
            case FONT_FAMILY -> type(String.class);
            case TEXT_COLOR -> type(Color.class);
            case PADDING -> type(Insets.class);
            case FILLS, STROKES -> json.getTypeFactory().constructType(new TypeReference<List<Paint>>() {});
            case POSITIONING -> type(LayoutStyle.Positioning.class);
            case HORIZONTAL_SIZING, VERTICAL_SIZING -> type(LayoutStyle.Sizing.class);
            case LAYOUT_MODE -> type(LayoutStyle.LayoutMode.class);
            case TEXT_ALIGN -> type(TextStyle.Align.class);
        };
    }

    private JavaType typeOf(ContentField field) {
        return switch (field) {
            case CLIPS_CONTENT, FILLS_ENABLED, STROKES_ENABLED, EFFECTS_ENABLED -> type(Boolean.class);
            case TEXT, IMAGE_REF, GEOMETRY_REF, OTHER_TYPE -> type(String.class);
            case RUNS -> json.getTypeFactory().constructType(new TypeReference<List<TextRun>>() {});
            case SCALE_MODE -> type(ContentPayload.Image.ScaleMode.class);
        };
    }

    private JavaType type(Class<?> c) {
        return json.getTypeFactory().constructType(c);
    }

    // ----------------- helpers -----------------

    static int crc32(byte[] data) {
        CRC32 c = new CRC32();
        c.update(data, 0, data.length);
        return (int) c.getValue();
    }
}
