package com.gs.ep.pageflow.layout;

import com.gs.ep.pageflow.model.Line;
import com.gs.ep.pageflow.model.MarkerMeasure;
import com.gs.ep.pageflow.model.ParagraphMeasure;

import java.util.List;

/**
 * Working line set of one paragraph layout call. Starts from the measured lines and is replaced
 * wholesale by at most one column-width remeasure and one float remeasure.
 */
public class ParagraphLines {
    private List<Line> lines;
    private boolean remeasuredForColumnWidth;
    private boolean remeasuredForFloats;
    private MarkerMeasure remeasuredMarker;
    private double narrowestWidth;
    private double narrowestOffsetX;

    public ParagraphLines(List<Line> lines) {
        this.lines = lines;
    }

    public List<Line> getLines() {
        return lines;
    }

    public int size() {
        return lines.size();
    }

    public Line get(int index) {
        return lines.get(index);
    }

    public void replaceForColumnWidth(ParagraphMeasure measure) {
        replace(measure);
        remeasuredForColumnWidth = true;
    }

    public void replaceForFloats(ParagraphMeasure measure, double narrowestWidth, double narrowestOffsetX) {
        replace(measure);
        this.remeasuredForFloats = true;
        this.narrowestWidth = narrowestWidth;
        this.narrowestOffsetX = narrowestOffsetX;
    }

    private void replace(ParagraphMeasure measure) {
        lines = LayoutUtils.normalizeLines(measure);
        if (measure.marker != null) {
            remeasuredMarker = measure.marker;
        }
    }

    public boolean isRemeasuredForColumnWidth() {
        return remeasuredForColumnWidth;
    }

    public boolean isRemeasuredForFloats() {
        return remeasuredForFloats;
    }

    public MarkerMeasure getRemeasuredMarker() {
        return remeasuredMarker;
    }

    public double getNarrowestWidth() {
        return narrowestWidth;
    }

    public double getNarrowestOffsetX() {
        return narrowestOffsetX;
    }
}
