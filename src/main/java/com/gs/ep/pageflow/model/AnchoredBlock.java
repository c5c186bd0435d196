package com.gs.ep.pageflow.model;

import com.gs.ep.pageflow.model.attribute.ImageAnchor;
import com.gs.ep.pageflow.model.attribute.ImageWrap;

/**
 * An image or drawing anchored to a paragraph and positioned outside the text flow.
 */
public abstract class AnchoredBlock {
    public final String id;
    public final ImageAnchor anchor;
    public final ImageWrap wrap;
    public final Integer pmStart;
    public final Integer pmEnd;

    protected AnchoredBlock(String id, ImageAnchor anchor, ImageWrap wrap, Integer pmStart, Integer pmEnd) {
        this.id = id;
        this.anchor = anchor;
        this.wrap = wrap == null ? ImageWrap.SQUARE : wrap;
        this.pmStart = pmStart;
        this.pmEnd = pmEnd;
    }

    public abstract BlockKind getKind();

    public boolean isBehindDoc() {
        return anchor != null && anchor.behindDoc;
    }
}
