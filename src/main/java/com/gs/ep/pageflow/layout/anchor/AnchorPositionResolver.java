package com.gs.ep.pageflow.layout.anchor;

import com.gs.ep.pageflow.layout.PageState;
import com.gs.ep.pageflow.model.Columns;
import com.gs.ep.pageflow.model.PageMargins;
import com.gs.ep.pageflow.model.attribute.HorizontalAlign;
import com.gs.ep.pageflow.model.attribute.HorizontalRelativeFrom;
import com.gs.ep.pageflow.model.attribute.ImageAnchor;
import com.gs.ep.pageflow.model.attribute.VerticalAlign;
import com.gs.ep.pageflow.model.attribute.VerticalRelativeFrom;

/**
 * Resolves the page coordinates of an anchored object from its anchor description.
 */
public final class AnchorPositionResolver {

    private AnchorPositionResolver() {
    }

    /**
     * X of an anchored object. The reference box comes from {@code hRelativeFrom} (page, margin
     * box, or the current column when absent); the object is aligned inside it or, without an
     * alignment, shifted by {@code offsetH} from its left edge.
     */
    public static double computeAnchorX(ImageAnchor anchor, int columnIndex, Columns columns, double objectWidth,
                                        PageMargins margins, double pageWidth) {
        double baseX;
        double boxWidth;
        HorizontalRelativeFrom relativeFrom = anchor.hRelativeFrom == null
                ? HorizontalRelativeFrom.COLUMN
                : anchor.hRelativeFrom;
        switch (relativeFrom) {
            case PAGE:
                baseX = 0;
                boxWidth = pageWidth;
                break;
            case MARGIN:
                baseX = margins.left;
                boxWidth = pageWidth - margins.left - margins.right;
                break;
            case COLUMN:
            default:
                baseX = margins.left + columnIndex * (columns.width + columns.gap);
                boxWidth = columns.width;
                break;
        }

        HorizontalAlign align = anchor.alignH;
        if (align == null) {
            return baseX + anchor.finiteOffsetH();
        }
        switch (align) {
            case RIGHT:
                return baseX + boxWidth - objectWidth;
            case CENTER:
                return baseX + (boxWidth - objectWidth) / 2;
            case LEFT:
            default:
                return baseX;
        }
    }

    /**
     * Y of an anchored object.
     *
     * <ul>
     *   <li>margin: relative to the content box of the current page</li>
     *   <li>page: relative to the physical page, whose height is {@code contentBottom + bottomMargin}</li>
     *   <li>paragraph: relative to the cursor, aligned against the first line's height</li>
     *   <li>absent: cursor plus offset</li>
     * </ul>
     */
    public static double computeAnchorY(ImageAnchor anchor, double objectHeight, PageState state,
                                        double firstLineHeight, double bottomMargin) {
        double offsetV = anchor == null ? 0 : anchor.finiteOffsetV();
        VerticalRelativeFrom relativeFrom = anchor == null ? null : anchor.vRelativeFrom;
        VerticalAlign alignV = anchor == null ? null : anchor.alignV;

        if (relativeFrom == null) {
            return state.cursorY + offsetV;
        }

        double contentTop = state.topMargin;
        double contentBottom = state.contentBottom;
        switch (relativeFrom) {
            case MARGIN: {
                double contentHeight = Math.max(0, contentBottom - contentTop);
                return aligned(alignV, contentTop, contentHeight, objectHeight) + offsetV;
            }
            case PAGE: {
                double pageHeight = contentBottom + bottomMargin;
                return aligned(alignV, 0, pageHeight, objectHeight) + offsetV;
            }
            case PARAGRAPH:
            default:
                return aligned(alignV, state.cursorY, firstLineHeight, objectHeight) + offsetV;
        }
    }

    private static double aligned(VerticalAlign alignV, double boxTop, double boxHeight, double objectHeight) {
        if (alignV == null) {
            return boxTop;
        }
        switch (alignV) {
            case BOTTOM:
                return boxTop + boxHeight - objectHeight;
            case CENTER:
                return boxTop + (boxHeight - objectHeight) / 2;
            case TOP:
            default:
                return boxTop;
        }
    }
}
