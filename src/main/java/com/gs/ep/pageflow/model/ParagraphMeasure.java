package com.gs.ep.pageflow.model;

import java.util.Collections;
import java.util.List;

/**
 * Line geometry of one paragraph. Owned by the measurer and read-only for layout.
 */
public class ParagraphMeasure {
    public final List<Line> lines;
    public final double totalHeight;
    public final MarkerMeasure marker;

    public ParagraphMeasure(List<Line> lines, double totalHeight, MarkerMeasure marker) {
        this.lines = lines == null ? Collections.emptyList() : Collections.unmodifiableList(lines);
        this.totalHeight = totalHeight;
        this.marker = marker;
    }

    public ParagraphMeasure(List<Line> lines, double totalHeight) {
        this(lines, totalHeight, null);
    }

    /**
     * Builds a measure whose total height is the sum of its line heights.
     */
    public static ParagraphMeasure ofLines(List<Line> lines, MarkerMeasure marker) {
        double total = 0;
        for (Line line : lines) {
            total += line.safeLineHeight();
        }
        return new ParagraphMeasure(lines, total, marker);
    }

    public boolean hasMarker() {
        return marker != null;
    }
}
