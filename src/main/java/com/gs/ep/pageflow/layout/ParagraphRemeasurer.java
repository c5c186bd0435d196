package com.gs.ep.pageflow.layout;

import com.gs.ep.pageflow.model.ParagraphBlock;
import com.gs.ep.pageflow.model.ParagraphMeasure;

/**
 * Re-runs line breaking for a paragraph at a new width.
 * Hosts that cannot remeasure pass {@link #NONE}; layout then keeps the original line geometry.
 */
public interface ParagraphRemeasurer {

    ParagraphRemeasurer NONE = new ParagraphRemeasurer() {
        @Override
        public boolean isAvailable() {
            return false;
        }

        @Override
        public ParagraphMeasure remeasure(ParagraphBlock block, double maxWidth, double firstLineIndent) {
            throw new UnsupportedOperationException("No remeasurer configured");
        }
    };

    /**
     * @param maxWidth        width available to the paragraph box; the measurer subtracts the
     *                        paragraph's own indents from it
     * @param firstLineIndent extra space taken on the first line only (inline list marker)
     */
    ParagraphMeasure remeasure(ParagraphBlock block, double maxWidth, double firstLineIndent);

    default boolean isAvailable() {
        return true;
    }
}
