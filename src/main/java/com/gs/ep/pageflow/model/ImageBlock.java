package com.gs.ep.pageflow.model;

import com.gs.ep.pageflow.model.attribute.ImageAnchor;
import com.gs.ep.pageflow.model.attribute.ImageWrap;

public class ImageBlock extends AnchoredBlock {
    public final String src;

    public ImageBlock(String id, String src, ImageAnchor anchor, ImageWrap wrap, Integer pmStart, Integer pmEnd) {
        super(id, anchor, wrap, pmStart, pmEnd);
        this.src = src;
    }

    @Override
    public BlockKind getKind() {
        return BlockKind.IMAGE;
    }
}
