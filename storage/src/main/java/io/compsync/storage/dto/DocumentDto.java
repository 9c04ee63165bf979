// file: storage/src/main/java/io/compsync/storage/dto/DocumentDto.java
package io.compsync.storage.dto;

import java.util.List;

/**
 * JSON shape of a document as produced by the export/transform stage.
 * <p>
 * Example:
 *   {
 *     "id": "lib-core",
 *     "name": "Core components",
 *     "root": { "id": "0:1", "name": "Page", "children": [ ... ] }
 *   }
 * Missing attributes fall back to the defaults below.
 */
public class DocumentDto {
    public String id;
    public String name;
    public NodeDto root;

    public static class NodeDto {
        public String id;
        public String name;
        public String variantGroup;       // set on members of a component set
        public StyleDto style;
        public ContentDto content;        // missing => plain container
        public List<NodeDto> children;
        public ComponentRefDto componentRef; // present on instances only
    }

    public static class ComponentRefDto {
        public String documentId;
        public String componentId;
        public String componentName;
        public String componentSetName;
    }

    public static class StyleDto {
        public LayoutDto layout;
        public VisualDto visual;
        public TextStyleDto text;
    }

    public static class LayoutDto {
        public String positioning = "ABSOLUTE";
        public double x;
        public double y;
        public String horizontalSizing = "FIXED";
        public String verticalSizing = "FIXED";
        public double width;
        public double height;
        public String layoutMode = "NONE";
        public InsetsDto padding;
        public double itemSpacing;
    }

    public static class InsetsDto {
        public double top;
        public double right;
        public double bottom;
        public double left;
    }

    public static class VisualDto {
        public List<PaintDto> fills;
        public List<PaintDto> strokes;
        public double strokeWidth = 1.0;
        public double cornerRadius;
        public double opacity = 1.0;
        public boolean visible = true;
    }

    public static class PaintDto {
        public String type = "SOLID";
        public ColorDto color;
        public double opacity = 1.0;
        public boolean visible = true;
    }

    public static class ColorDto {
        public double r;
        public double g;
        public double b;
        public double a = 1.0;
    }

    public static class TextStyleDto {
        public String fontFamily;
        public double fontSize = 12;
        public int fontWeight = 400;
        public ColorDto color;
        public double lineHeight;
        public double letterSpacing;
        public String align = "LEFT";
    }

    /**
     * Union of all content variants, discriminated by {@code type}:
     * CONTAINER, TEXT, STYLED_TEXT, IMAGE, VECTOR or OTHER.
     */
    public static class ContentDto {
        public String type = "CONTAINER";
        // CONTAINER
        public boolean clipsContent;
        public boolean fillsEnabled = true;
        public boolean strokesEnabled = true;
        public boolean effectsEnabled = true;
        // TEXT
        public String text;
        // STYLED_TEXT
        public List<TextRunDto> runs;
        // IMAGE
        public String imageRef;
        public String scaleMode = "FILL";
        // VECTOR
        public String geometryRef;
        // OTHER
        public String otherType;
    }

    public static class TextRunDto {
        public String text;
        public TextStyleDto style;
    }
}
