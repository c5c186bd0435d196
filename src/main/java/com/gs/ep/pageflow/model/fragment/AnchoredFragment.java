package com.gs.ep.pageflow.model.fragment;

/**
 * Common state of image and drawing fragments placed from an anchor.
 */
public abstract class AnchoredFragment implements Fragment {
    private final String blockId;
    private final double x;
    private final double y;
    private final double width;
    private final double height;
    private final int zIndex;
    private final Integer pmStart;
    private final Integer pmEnd;

    protected AnchoredFragment(String blockId, double x, double y, double width, double height,
                               int zIndex, Integer pmStart, Integer pmEnd) {
        this.blockId = blockId;
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
        this.zIndex = zIndex;
        this.pmStart = pmStart;
        this.pmEnd = pmEnd;
    }

    @Override
    public String getBlockId() {
        return blockId;
    }

    @Override
    public double getX() {
        return x;
    }

    @Override
    public double getY() {
        return y;
    }

    @Override
    public double getWidth() {
        return width;
    }

    public double getHeight() {
        return height;
    }

    public boolean isAnchored() {
        return true;
    }

    /** 0 for objects behind the text, 1 otherwise. */
    public int getZIndex() {
        return zIndex;
    }

    @Override
    public Integer getPmStart() {
        return pmStart;
    }

    @Override
    public Integer getPmEnd() {
        return pmEnd;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + blockId + " @(" + x + ", " + y + ") "
                + width + "x" + height + " z=" + zIndex + "]";
    }
}
