package com.gs.ep.pageflow.model;

/**
 * Resolved column geometry of a section: equal-width columns separated by a gap.
 */
public class Columns {
    public final double width;
    public final double gap;
    public final int count;

    public Columns(double width, double gap, int count) {
        this.width = width;
        this.gap = gap;
        this.count = count;
    }

    /**
     * Splits a content width into {@code count} equal columns.
     */
    public static Columns split(double contentWidth, int count, double gap) {
        if (count < 1) {
            throw new IllegalArgumentException("Column count must be at least 1, got " + count);
        }
        double safeGap = count == 1 ? 0 : Math.max(0, gap);
        double width = (contentWidth - safeGap * (count - 1)) / count;
        return new Columns(Math.max(0, width), safeGap, count);
    }

    @Override
    public String toString() {
        return "Columns[count=" + count + ", width=" + width + ", gap=" + gap + "]";
    }
}
