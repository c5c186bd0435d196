package com.gs.ep.pageflow.model.fragment;

import com.gs.ep.pageflow.model.DrawingGeometry;
import com.gs.ep.pageflow.model.DrawingKind;

public class DrawingFragment extends AnchoredFragment {
    private final DrawingKind drawingKind;
    private final DrawingGeometry geometry;
    private final double scale;
    private final String drawingContentId;

    public DrawingFragment(String blockId, DrawingKind drawingKind, double x, double y, double width, double height,
                           int zIndex, DrawingGeometry geometry, double scale, String drawingContentId,
                           Integer pmStart, Integer pmEnd) {
        super(blockId, x, y, width, height, zIndex, pmStart, pmEnd);
        this.drawingKind = drawingKind;
        this.geometry = geometry;
        this.scale = scale;
        this.drawingContentId = drawingContentId;
    }

    @Override
    public FragmentKind getKind() {
        return FragmentKind.DRAWING;
    }

    public DrawingKind getDrawingKind() {
        return drawingKind;
    }

    public DrawingGeometry getGeometry() {
        return geometry;
    }

    public double getScale() {
        return scale;
    }

    public String getDrawingContentId() {
        return drawingContentId;
    }
}
