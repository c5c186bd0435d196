package com.gs.ep.pageflow.model;

public class DrawingGeometry {
    public final double width;
    public final double height;
    public final double rotation;
    public final boolean flipH;
    public final boolean flipV;

    public DrawingGeometry(double width, double height, double rotation, boolean flipH, boolean flipV) {
        this.width = width;
        this.height = height;
        this.rotation = rotation;
        this.flipH = flipH;
        this.flipV = flipV;
    }
}
