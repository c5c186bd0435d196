package com.gs.ep.pageflow.model.attribute;

/**
 * Frame properties of a floating/positioned paragraph. Offsets are in pixels.
 */
public class FrameAttributes {
    public final FrameWrap wrap;
    public final Double x;
    public final Double y;
    public final HorizontalAlign xAlign;

    public FrameAttributes(FrameWrap wrap, Double x, Double y, HorizontalAlign xAlign) {
        this.wrap = wrap;
        this.x = x;
        this.y = y;
        this.xAlign = xAlign;
    }

    /**
     * A frame with wrap "none" is placed absolutely and does not take part in text flow.
     */
    public boolean isPositioned() {
        return wrap == FrameWrap.NONE;
    }

    public double finiteX() {
        return x != null && Double.isFinite(x) ? x : 0;
    }

    public double finiteY() {
        return y != null && Double.isFinite(y) ? y : 0;
    }
}
