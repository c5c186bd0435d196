package com.gs.ep.pageflow.model.attribute;

/**
 * List layout attached to a paragraph.
 *
 * <p>With {@code firstLineIndentMode} the marker sits inline at {@code left + firstLine} and
 * consumes space on the first text line. Otherwise the marker hangs at {@code left - hanging}
 * and every line starts at {@code left}.
 */
public class WordLayout {
    public final MarkerLayout marker;
    public final boolean firstLineIndentMode;

    public WordLayout(MarkerLayout marker, boolean firstLineIndentMode) {
        this.marker = marker;
        this.firstLineIndentMode = firstLineIndentMode;
    }
}
