// file: core/src/main/java/io/compsync/core/model/TextRun.java
package io.compsync.core.model;

/** One run of styled text: a substring plus the style applied to it. */
public record TextRun(String text, TextStyle style) {
    public TextRun {
        if (text == null) text = "";
        if (style == null) style = TextStyle.DEFAULT;
    }
}
