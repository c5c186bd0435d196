package com.gs.ep.pageflow.model;

/**
 * Slice of one run within a line, optionally pinned at an explicit x offset (tab stop).
 */
public class LineSegment {
    public final int runIndex;
    public final int fromChar;
    public final int toChar;
    public final double width;
    public final Double x;

    public LineSegment(int runIndex, int fromChar, int toChar, double width, Double x) {
        this.runIndex = runIndex;
        this.fromChar = fromChar;
        this.toChar = toChar;
        this.width = width;
        this.x = x;
    }
}
