package com.gs.ep.pageflow.model;

/**
 * Page margins in pixels.
 */
public class PageMargins {
    public final double top;
    public final double right;
    public final double bottom;
    public final double left;

    public PageMargins(double top, double right, double bottom, double left) {
        this.top = top;
        this.right = right;
        this.bottom = bottom;
        this.left = left;
    }

    @Override
    public String toString() {
        return "PageMargins[top=" + top + ", right=" + right + ", bottom=" + bottom + ", left=" + left + "]";
    }
}
