// file: storage/src/main/java/io/compsync/storage/DocumentReader.java
package io.compsync.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.compsync.core.model.Color;
import io.compsync.core.model.ComponentRef;
import io.compsync.core.model.ContentKind;
import io.compsync.core.model.ContentPayload;
import io.compsync.core.model.Document;
import io.compsync.core.model.Insets;
import io.compsync.core.model.LayoutStyle;
import io.compsync.core.model.Node;
import io.compsync.core.model.Paint;
import io.compsync.core.model.StyleBundle;
import io.compsync.core.model.TextRun;
import io.compsync.core.model.TextStyle;
import io.compsync.core.model.VisualStyle;
import io.compsync.storage.dto.DocumentDto;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads JSON documents (see {@link DocumentDto}) into immutable node trees.
 * <p>
 * Unknown JSON properties are ignored so exports may carry extra data.
 * Anything that prevents building a valid tree raises
 * {@link DocumentFormatException} with the path of the offending node.
 */
public final class DocumentReader {

    private final ObjectMapper json = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public Document read(byte[] bytes) {
        DocumentDto dto;
        try {
            dto = json.readValue(bytes, DocumentDto.class);
        } catch (JsonProcessingException e) {
            throw new DocumentFormatException("invalid JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new DocumentFormatException("unreadable document", e);
        }
        return toDocument(dto);
    }

    public Document read(Path path) throws IOException {
        return read(Files.readAllBytes(path));
    }

    Document toDocument(DocumentDto dto) {
        if (dto == null) throw new DocumentFormatException("empty document");
        if (dto.id == null || dto.id.isBlank()) throw new DocumentFormatException("document id is missing");
        if (dto.root == null) throw new DocumentFormatException("document " + dto.id + " has no root node");
        return new Document(dto.id, dto.name, toNode(dto.root, "/", dto.id));
    }

    private Node toNode(DocumentDto.NodeDto n, String parentPath, String documentId) {
        if (n.id == null || n.id.isBlank()) {
            throw new DocumentFormatException("node without id under " + parentPath);
        }
        String path = parentPath + n.id + "/";

        List<Node> children = new ArrayList<>();
        if (n.children != null) {
            for (DocumentDto.NodeDto c : n.children) {
                if (c == null) throw new DocumentFormatException("null child under " + path);
                children.add(toNode(c, path, documentId));
            }
        }

        try {
            return new Node(
                    n.id,
                    n.name,
                    n.variantGroup,
                    toStyle(n.style),
                    toContent(n.content),
                    children,
                    toRef(n.componentRef, documentId)
            );
        } catch (IllegalArgumentException e) {
            throw new DocumentFormatException("bad node " + path + ": " + e.getMessage(), e);
        }
    }

    /** A ref naming no document points into the document being read. */
    private static ComponentRef toRef(DocumentDto.ComponentRefDto r, String documentId) {
        if (r == null) return null;
        String owner = r.documentId == null || r.documentId.isBlank() ? documentId : r.documentId;
        return new ComponentRef(owner, r.componentId, r.componentName, r.componentSetName);
    }

    private static StyleBundle toStyle(DocumentDto.StyleDto s) {
        if (s == null) return StyleBundle.DEFAULT;
        return new StyleBundle(toLayout(s.layout), toVisual(s.visual), toText(s.text));
    }

    private static LayoutStyle toLayout(DocumentDto.LayoutDto l) {
        if (l == null) return null;
        Insets padding = l.padding == null
                ? Insets.ZERO
                : new Insets(l.padding.top, l.padding.right, l.padding.bottom, l.padding.left);
        return new LayoutStyle(
                enumOf(LayoutStyle.Positioning.class, l.positioning),
                l.x,
                l.y,
                enumOf(LayoutStyle.Sizing.class, l.horizontalSizing),
                enumOf(LayoutStyle.Sizing.class, l.verticalSizing),
                l.width,
                l.height,
                enumOf(LayoutStyle.LayoutMode.class, l.layoutMode),
                padding,
                l.itemSpacing
        );
    }

    private static VisualStyle toVisual(DocumentDto.VisualDto v) {
        if (v == null) return null;
        return new VisualStyle(paints(v.fills), paints(v.strokes), v.strokeWidth, v.cornerRadius, v.opacity, v.visible);
    }

    private static List<Paint> paints(List<DocumentDto.PaintDto> in) {
        if (in == null) return List.of();
        List<Paint> out = new ArrayList<>(in.size());
        for (DocumentDto.PaintDto p : in) {
            if (p == null) continue;
            out.add(new Paint(enumOf(Paint.Type.class, p.type), toColor(p.color), p.opacity, p.visible));
        }
        return out;
    }

    private static TextStyle toText(DocumentDto.TextStyleDto t) {
        if (t == null) return null;
        return new TextStyle(
                t.fontFamily == null ? TextStyle.DEFAULT.fontFamily() : t.fontFamily,
                t.fontSize,
                t.fontWeight,
                t.color == null ? TextStyle.DEFAULT.color() : toColor(t.color),
                t.lineHeight,
                t.letterSpacing,
                enumOf(TextStyle.Align.class, t.align)
        );
    }

    private static Color toColor(DocumentDto.ColorDto c) {
        if (c == null) return null;
        return new Color(c.r, c.g, c.b, c.a);
    }

    private static ContentPayload toContent(DocumentDto.ContentDto c) {
        if (c == null) return ContentPayload.Container.DEFAULT;
        ContentKind kind = enumOf(ContentKind.class, c.type);
        return switch (kind) {
            case CONTAINER -> new ContentPayload.Container(
                    c.clipsContent, c.fillsEnabled, c.strokesEnabled, c.effectsEnabled);
            case TEXT -> new ContentPayload.Text(c.text);
            case STYLED_TEXT -> new ContentPayload.StyledText(runs(c.runs));
            case IMAGE -> new ContentPayload.Image(
                    c.imageRef, enumOf(ContentPayload.Image.ScaleMode.class, c.scaleMode));
            case VECTOR -> new ContentPayload.Vector(c.geometryRef);
            case OTHER -> new ContentPayload.Other(c.otherType);
        };
    }

    private static List<TextRun> runs(List<DocumentDto.TextRunDto> in) {
        if (in == null) return List.of();
        List<TextRun> out = new ArrayList<>(in.size());
        for (DocumentDto.TextRunDto r : in) {
            if (r == null) continue;
            out.add(new TextRun(r.text, toText(r.style)));
        }
        return out;
    }

    private static <E extends Enum<E>> E enumOf(Class<E> type, String value) {
        if (value == null) return null;
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new DocumentFormatException(
                    "unknown " + type.getSimpleName() + " '" + value + "'", e);
        }
    }
}
