package com.gs.ep.pageflow.layout.floats;

import com.gs.ep.pageflow.model.attribute.WrapText;

/**
 * Rectangle, in page coordinates and including wrap distances, that text on a page/column must
 * avoid.
 */
public class ExclusionZone {
    public final String blockId;
    public final int pageNumber;
    public final int columnIndex;
    public final double left;
    public final double right;
    public final double top;
    public final double bottom;
    public final WrapText wrapText;

    public ExclusionZone(String blockId, int pageNumber, int columnIndex,
                         double left, double right, double top, double bottom, WrapText wrapText) {
        this.blockId = blockId;
        this.pageNumber = pageNumber;
        this.columnIndex = columnIndex;
        this.left = left;
        this.right = right;
        this.top = top;
        this.bottom = bottom;
        this.wrapText = wrapText == null ? WrapText.BOTH_SIDES : wrapText;
    }

    /**
     * @return true when the band {@code [lineY, lineY + lineHeight)} intersects this zone vertically
     */
    public boolean overlapsBand(double lineY, double lineHeight) {
        double bandBottom = lineY + Math.max(lineHeight, 0);
        return lineY < bottom && bandBottom > top;
    }

    public boolean appliesTo(int pageNumber, int columnIndex) {
        return this.pageNumber == pageNumber && this.columnIndex == columnIndex;
    }

    @Override
    public String toString() {
        return "ExclusionZone{" + blockId + ", page=" + pageNumber + ", column=" + columnIndex
                + ", x=[" + left + ", " + right + "], y=[" + top + ", " + bottom + "], " + wrapText + "}";
    }
}
