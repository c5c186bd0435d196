package com.gs.ep.pageflow.layout;

/**
 * Width left for text in a vertical band once floats are excluded, and where it starts relative
 * to the column's left edge.
 */
public class AvailableWidth {
    public final double width;
    public final double offsetX;

    public AvailableWidth(double width, double offsetX) {
        this.width = width;
        this.offsetX = offsetX;
    }

    public static AvailableWidth full(double columnWidth) {
        return new AvailableWidth(columnWidth, 0);
    }

    @Override
    public String toString() {
        return "AvailableWidth[width=" + width + ", offsetX=" + offsetX + "]";
    }
}
