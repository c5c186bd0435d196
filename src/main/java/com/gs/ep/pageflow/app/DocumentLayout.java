package com.gs.ep.pageflow.app;

import com.gs.ep.pageflow.layout.Page;
import com.gs.ep.pageflow.layout.paginator.PageGeometry;
import com.gs.ep.pageflow.model.fragment.Fragment;
import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.api.list.MutableList;

/**
 * Result of laying out a document: its pages in order and the geometry they were laid out on.
 */
public class DocumentLayout {
    private final MutableList<Page> pages;
    private final PageGeometry geometry;

    public DocumentLayout(MutableList<Page> pages, PageGeometry geometry) {
        this.pages = pages;
        this.geometry = geometry;
    }

    public ListIterable<Page> getPages() {
        return pages.asUnmodifiable();
    }

    public int getPageCount() {
        return pages.size();
    }

    public Page getPage(int number) {
        return pages.get(number - 1);
    }

    public PageGeometry getGeometry() {
        return geometry;
    }

    public ListIterable<Fragment> fragmentsOf(String blockId) {
        return pages.flatCollect(page -> page.fragments).select(fragment -> blockId.equals(fragment.getBlockId()));
    }
}
