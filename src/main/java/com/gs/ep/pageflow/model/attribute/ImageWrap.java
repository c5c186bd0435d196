package com.gs.ep.pageflow.model.attribute;

/**
 * Text wrapping around an anchored object. Distances are in pixels.
 */
public class ImageWrap {
    public static final ImageWrap SQUARE = new ImageWrap(WrapType.SQUARE, WrapText.BOTH_SIDES, 0, 0, 0, 0);

    public final WrapType type;
    public final WrapText wrapText;
    public final double distTop;
    public final double distBottom;
    public final double distLeft;
    public final double distRight;

    public ImageWrap(WrapType type, WrapText wrapText,
                     double distTop, double distBottom, double distLeft, double distRight) {
        this.type = type == null ? WrapType.SQUARE : type;
        this.wrapText = wrapText == null ? WrapText.BOTH_SIDES : wrapText;
        this.distTop = distTop;
        this.distBottom = distBottom;
        this.distLeft = distLeft;
        this.distRight = distRight;
    }
}
