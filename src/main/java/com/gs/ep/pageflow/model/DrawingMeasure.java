package com.gs.ep.pageflow.model;

public class DrawingMeasure extends ObjectMeasure {
    public final DrawingGeometry geometry;
    public final double scale;

    public DrawingMeasure(double width, double height, DrawingGeometry geometry, double scale) {
        super(width, height);
        this.geometry = geometry;
        this.scale = scale;
    }

    @Override
    public BlockKind getKind() {
        return BlockKind.DRAWING;
    }
}
