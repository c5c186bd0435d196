package com.gs.ep.pageflow.layout;

import com.gs.ep.pageflow.model.ParagraphBlock;
import com.gs.ep.pageflow.model.ParagraphMeasure;
import com.gs.ep.pageflow.model.attribute.WordLayout;

/**
 * First-line indent handed to the remeasurer for list paragraphs.
 *
 * <p>In the standard hanging layout the marker sits in the hanging region and the first line is
 * as wide as the others, so the indent is 0. In first-line-indent mode the marker is inline and
 * the first line loses {@code markerWidth + gutterWidth}.
 */
public final class MarkerIndents {

    private MarkerIndents() {
    }

    public static double calculateFirstLineIndent(ParagraphBlock block, ParagraphMeasure measure) {
        WordLayout wordLayout = block.attrs.wordLayout;
        if (wordLayout == null || !wordLayout.firstLineIndentMode) {
            return 0;
        }
        if (wordLayout.marker == null || measure.marker == null) {
            return 0;
        }

        Double markerWidthRaw = measure.marker.markerWidth != null
                ? measure.marker.markerWidth
                : wordLayout.marker.markerBoxWidthPx;
        double markerWidth = LayoutNumbers.safeNonNegative(markerWidthRaw);
        double gutterWidth = LayoutNumbers.safeNonNegative(measure.marker.gutterWidth);
        return markerWidth + gutterWidth;
    }
}
