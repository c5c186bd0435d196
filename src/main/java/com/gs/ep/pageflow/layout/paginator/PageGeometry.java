package com.gs.ep.pageflow.layout.paginator;

import com.gs.ep.pageflow.model.Columns;
import com.gs.ep.pageflow.model.PageMargins;

/**
 * Fixed page size, margins and column split shared by every page of a layout run.
 */
public class PageGeometry {
    public final double pageWidth;
    public final double pageHeight;
    public final PageMargins margins;
    public final Columns columns;

    public PageGeometry(double pageWidth, double pageHeight, PageMargins margins, int columnCount, double columnGap) {
        if (!(pageWidth > 0) || !(pageHeight > 0)) {
            throw new IllegalArgumentException("Page size must be positive, got " + pageWidth + "x" + pageHeight);
        }
        if (margins == null) {
            throw new IllegalArgumentException("Page margins are required");
        }
        double contentWidth = pageWidth - margins.left - margins.right;
        if (!(contentWidth > 0)) {
            throw new IllegalArgumentException("Margins " + margins + " leave no content width on a page "
                    + pageWidth + " wide");
        }
        if (!(pageHeight - margins.bottom > margins.top)) {
            throw new IllegalArgumentException("Margins " + margins + " leave no content height on a page "
                    + pageHeight + " high");
        }
        this.pageWidth = pageWidth;
        this.pageHeight = pageHeight;
        this.margins = margins;
        this.columns = Columns.split(contentWidth, columnCount, columnGap);
    }

    public double contentWidth() {
        return pageWidth - margins.left - margins.right;
    }

    public double contentBottom() {
        return pageHeight - margins.bottom;
    }

    public double columnX(int columnIndex) {
        return margins.left + columnIndex * (columns.width + columns.gap);
    }

    @Override
    public String toString() {
        return "PageGeometry{" + pageWidth + "x" + pageHeight + ", margins=" + margins + ", columns=" + columns + "}";
    }
}
