package com.gs.ep.pageflow.model;

/**
 * Measured box of an anchored image or drawing, in pixels.
 */
public abstract class ObjectMeasure {
    public final double width;
    public final double height;

    protected ObjectMeasure(double width, double height) {
        this.width = width;
        this.height = height;
    }

    public abstract BlockKind getKind();
}
