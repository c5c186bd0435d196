package com.gs.ep.pageflow.model;

import com.gs.ep.pageflow.model.attribute.ImageAnchor;
import com.gs.ep.pageflow.model.attribute.ImageWrap;

public class DrawingBlock extends AnchoredBlock {
    public final DrawingKind drawingKind;
    public final String drawingContentId;

    public DrawingBlock(String id, DrawingKind drawingKind, String drawingContentId,
                        ImageAnchor anchor, ImageWrap wrap, Integer pmStart, Integer pmEnd) {
        super(id, anchor, wrap, pmStart, pmEnd);
        this.drawingKind = drawingKind;
        this.drawingContentId = drawingContentId;
    }

    @Override
    public BlockKind getKind() {
        return BlockKind.DRAWING;
    }
}
