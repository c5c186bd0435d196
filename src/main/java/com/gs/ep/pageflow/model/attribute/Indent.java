package com.gs.ep.pageflow.model.attribute;

/**
 * Paragraph indents in pixels. Negative values bleed into the page margin.
 */
public class Indent {
    public static final Indent NONE = new Indent(null, null);

    public final Double left;
    public final Double right;

    public Indent(Double left, Double right) {
        this.left = left;
        this.right = right;
    }

    /** Left indent, zero when absent or non-finite. Sign is kept. */
    public double finiteLeft() {
        return left != null && Double.isFinite(left) ? left : 0;
    }

    /** Right indent, zero when absent or non-finite. Sign is kept. */
    public double finiteRight() {
        return right != null && Double.isFinite(right) ? right : 0;
    }
}
