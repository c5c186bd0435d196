package com.gs.ep.pageflow.model;

/**
 * Geometry of a list marker measured alongside its paragraph.
 * Any of the widths may be null when the measurer could not resolve them.
 */
public class MarkerMeasure {
    public final Double markerWidth;
    public final Double markerTextWidth;
    public final Double gutterWidth;
    public final double indentLeft;

    public MarkerMeasure(Double markerWidth, Double markerTextWidth, Double gutterWidth, double indentLeft) {
        this.markerWidth = markerWidth;
        this.markerTextWidth = markerTextWidth;
        this.gutterWidth = gutterWidth;
        this.indentLeft = indentLeft;
    }
}
