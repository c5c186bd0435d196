package com.gs.ep.pageflow.layout;

import com.gs.ep.pageflow.model.Columns;
import com.gs.ep.pageflow.model.PageMargins;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.set.MutableSet;
import org.eclipse.collections.impl.factory.Lists;

import java.util.List;

/**
 * Anchored objects attached to a paragraph and the page geometry needed to place them.
 * {@code placedAnchoredIds} is shared across paragraphs of a document so each object is placed once.
 */
public class ParagraphAnchorsContext {
    public final ImmutableList<AnchoredDrawingEntry> anchoredDrawings;
    public final double pageWidth;
    public final PageMargins pageMargins;
    public final Columns columns;
    public final MutableSet<String> placedAnchoredIds;

    public ParagraphAnchorsContext(List<AnchoredDrawingEntry> anchoredDrawings, double pageWidth,
                                   PageMargins pageMargins, Columns columns, MutableSet<String> placedAnchoredIds) {
        this.anchoredDrawings = anchoredDrawings == null
                ? Lists.immutable.empty()
                : Lists.immutable.withAll(anchoredDrawings);
        this.pageWidth = pageWidth;
        this.pageMargins = pageMargins;
        this.columns = columns;
        this.placedAnchoredIds = placedAnchoredIds;
    }

    public boolean hasDrawings() {
        return anchoredDrawings.notEmpty();
    }
}
