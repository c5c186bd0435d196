package com.gs.ep.pageflow.layout.paginator;

import com.gs.ep.pageflow.layout.Page;
import com.gs.ep.pageflow.layout.PageCursor;
import com.gs.ep.pageflow.layout.PageState;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Page cursor over a fixed {@link PageGeometry}. Pages are created lazily; moving past the last
 * column of a page starts a new page with a fresh state, so per-page carry-over such as the last
 * paragraph style does not cross page boundaries.
 */
public class Paginator implements PageCursor {
    private static final Logger LOGGER = LoggerFactory.getLogger(Paginator.class);

    private final PageGeometry geometry;
    private final MutableList<Page> pages = Lists.mutable.empty();
    private PageState current;

    public Paginator(PageGeometry geometry) {
        this.geometry = geometry;
    }

    @Override
    public PageState ensurePage() {
        if (current == null) {
            current = newPage();
        }
        return current;
    }

    @Override
    public PageState advanceColumn(PageState state) {
        if (state.columnIndex + 1 < geometry.columns.count) {
            state.columnIndex++;
            state.cursorY = state.topMargin;
            state.trailingSpacing = 0;
            LOGGER.trace("Advanced to column {} on page {}", state.columnIndex, state.page.number);
            current = state;
            return state;
        }
        current = newPage();
        return current;
    }

    @Override
    public double columnX(int columnIndex) {
        return geometry.columnX(columnIndex);
    }

    public MutableList<Page> getPages() {
        return pages;
    }

    public PageGeometry getGeometry() {
        return geometry;
    }

    private PageState newPage() {
        Page page = new Page(pages.size() + 1);
        pages.add(page);
        LOGGER.debug("Started page {}", page.number);
        return new PageState(page, 0, geometry.margins.top, geometry.contentBottom());
    }
}
