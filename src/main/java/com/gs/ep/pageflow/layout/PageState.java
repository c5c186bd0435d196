package com.gs.ep.pageflow.layout;

/**
 * The page/column cursor: where the next line of content will be written.
 *
 * <p>Advances monotonically in document order and is mutated in place by paragraph layout.
 * {@code trailingSpacing} holds the spacing-after of the most recently placed paragraph that has
 * not yet been collapsed against the next paragraph's spacing-before; NaN, infinite and negative
 * values read as zero.
 */
public class PageState {
    public Page page;
    public int columnIndex;
    public double cursorY;
    public double topMargin;
    public double contentBottom;
    public double trailingSpacing;
    public String lastParagraphStyleId;

    public PageState(Page page, int columnIndex, double topMargin, double contentBottom) {
        this.page = page;
        this.columnIndex = columnIndex;
        this.topMargin = topMargin;
        this.contentBottom = contentBottom;
        this.cursorY = topMargin;
        this.trailingSpacing = 0;
    }

    public double remainingHeight() {
        return contentBottom - cursorY;
    }

    public double contentHeight() {
        return Math.max(0, contentBottom - topMargin);
    }

    /**
     * Snapshot with its own page fragment list, for replaying a layout call.
     */
    public PageState copy() {
        PageState copy = new PageState(page.copy(), columnIndex, topMargin, contentBottom);
        copy.cursorY = cursorY;
        copy.trailingSpacing = trailingSpacing;
        copy.lastParagraphStyleId = lastParagraphStyleId;
        return copy;
    }

    @Override
    public String toString() {
        return "PageState[page=" + page.number + ", column=" + columnIndex + ", cursorY=" + cursorY
                + ", top=" + topMargin + ", bottom=" + contentBottom + ", trailing=" + trailingSpacing
                + ", lastStyle=" + lastParagraphStyleId + "]";
    }
}
