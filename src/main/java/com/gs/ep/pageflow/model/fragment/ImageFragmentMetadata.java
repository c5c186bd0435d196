package com.gs.ep.pageflow.model.fragment;

/**
 * Resize envelope for an anchored image: downstream resizing keeps the aspect ratio and stays
 * within {@code [min, max]}.
 */
public class ImageFragmentMetadata {
    public final double originalWidth;
    public final double originalHeight;
    public final double maxWidth;
    public final double maxHeight;
    public final double aspectRatio;
    public final double minWidth;
    public final double minHeight;

    public ImageFragmentMetadata(double originalWidth, double originalHeight, double maxWidth, double maxHeight,
                                 double aspectRatio, double minWidth, double minHeight) {
        this.originalWidth = originalWidth;
        this.originalHeight = originalHeight;
        this.maxWidth = maxWidth;
        this.maxHeight = maxHeight;
        this.aspectRatio = aspectRatio;
        this.minWidth = minWidth;
        this.minHeight = minHeight;
    }
}
