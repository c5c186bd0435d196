package com.gs.ep.pageflow.model.attribute;

/**
 * Positioning of an anchored image or drawing. Offsets are in pixels; any field may be null.
 */
public class ImageAnchor {
    public final HorizontalRelativeFrom hRelativeFrom;
    public final VerticalRelativeFrom vRelativeFrom;
    public final HorizontalAlign alignH;
    public final VerticalAlign alignV;
    public final Double offsetH;
    public final Double offsetV;
    public final boolean behindDoc;

    public ImageAnchor(HorizontalRelativeFrom hRelativeFrom, VerticalRelativeFrom vRelativeFrom,
                       HorizontalAlign alignH, VerticalAlign alignV,
                       Double offsetH, Double offsetV, boolean behindDoc) {
        this.hRelativeFrom = hRelativeFrom;
        this.vRelativeFrom = vRelativeFrom;
        this.alignH = alignH;
        this.alignV = alignV;
        this.offsetH = offsetH;
        this.offsetV = offsetV;
        this.behindDoc = behindDoc;
    }

    public double finiteOffsetH() {
        return offsetH != null && Double.isFinite(offsetH) ? offsetH : 0;
    }

    public double finiteOffsetV() {
        return offsetV != null && Double.isFinite(offsetV) ? offsetV : 0;
    }
}
