// file: core/src/main/java/io/compsync/core/diff/StyleField.java
package io.compsync.core.diff;

/**
 * Every style attribute the differ compares, grouped the way consumers
 * apply them (layout, background/border, typography).
 */
public enum StyleField {
    POSITIONING(Group.LAYOUT),
    X(Group.LAYOUT),
    Y(Group.LAYOUT),
    HORIZONTAL_SIZING(Group.LAYOUT),
    VERTICAL_SIZING(Group.LAYOUT),
    WIDTH(Group.LAYOUT),
    HEIGHT(Group.LAYOUT),
    LAYOUT_MODE(Group.LAYOUT),
    PADDING(Group.LAYOUT),
    ITEM_SPACING(Group.LAYOUT),

    FILLS(Group.VISUAL),
    STROKES(Group.VISUAL),
    STROKE_WIDTH(Group.VISUAL),
    CORNER_RADIUS(Group.VISUAL),
    OPACITY(Group.VISUAL),
    VISIBLE(Group.VISUAL),

    FONT_FAMILY(Group.TEXT),
    FONT_SIZE(Group.TEXT),
    FONT_WEIGHT(Group.TEXT),
    TEXT_COLOR(Group.TEXT),
    LINE_HEIGHT(Group.TEXT),
    LETTER_SPACING(Group.TEXT),
    TEXT_ALIGN(Group.TEXT);

    public enum Group { LAYOUT, VISUAL, TEXT }

    private final Group group;

    StyleField(Group group) {
        this.group = group;
    }

    public Group group() {
        return group;
    }
}
