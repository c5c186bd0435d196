package com.gs.ep.pageflow.app;

import com.gs.ep.pageflow.layout.AnchoredDrawingEntry;
import com.gs.ep.pageflow.model.ParagraphBlock;
import com.gs.ep.pageflow.model.ParagraphMeasure;

import java.util.Collections;
import java.util.List;

/**
 * A paragraph in document order, with its measure and the anchored objects attached to it.
 */
public class FlowItem {
    public final ParagraphBlock block;
    public final ParagraphMeasure measure;
    public final List<AnchoredDrawingEntry> anchoredDrawings;

    public FlowItem(ParagraphBlock block, ParagraphMeasure measure, List<AnchoredDrawingEntry> anchoredDrawings) {
        this.block = block;
        this.measure = measure;
        this.anchoredDrawings = anchoredDrawings == null
                ? Collections.emptyList()
                : Collections.unmodifiableList(anchoredDrawings);
    }

    public static FlowItem of(ParagraphBlock block, ParagraphMeasure measure) {
        return new FlowItem(block, measure, null);
    }
}
