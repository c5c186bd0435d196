package com.gs.ep.pageflow.layout;

/**
 * Result of slicing lines into available height: exclusive end index and the height taken.
 */
public class LineSlice {
    public final int toLine;
    public final double height;

    public LineSlice(int toLine, double height) {
        this.toLine = toLine;
        this.height = height;
    }
}
