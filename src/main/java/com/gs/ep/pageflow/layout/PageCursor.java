package com.gs.ep.pageflow.layout;

/**
 * Owner of the page/column cursor.
 */
public interface PageCursor {

    /**
     * @return the current mutable page state, creating the first page when none exists
     */
    PageState ensurePage();

    /**
     * Commits a move to the next column, or to a new page after the last column.
     * Implementations may mutate {@code state} or return a new instance; callers always use the
     * returned value.
     */
    PageState advanceColumn(PageState state);

    /**
     * @return the left edge of the given column, in page coordinates
     */
    double columnX(int columnIndex);
}
