package com.gs.ep.pageflow.model;

import com.gs.ep.pageflow.model.attribute.ParagraphAttributes;

import java.util.Collections;
import java.util.List;

/**
 * The semantic paragraph handed to layout: its runs plus typed layout attributes.
 * Immutable for the duration of a layout call.
 */
public class ParagraphBlock {
    public final String id;
    public final List<Run> runs;
    public final ParagraphAttributes attrs;

    public ParagraphBlock(String id, List<Run> runs, ParagraphAttributes attrs) {
        this.id = id;
        this.runs = runs == null ? Collections.emptyList() : Collections.unmodifiableList(runs);
        this.attrs = attrs == null ? ParagraphAttributes.EMPTY : attrs;
    }

    /**
     * True when the paragraph has no runs, or exactly one text run whose text is empty.
     */
    public boolean isEmptyText() {
        if (runs.isEmpty()) {
            return true;
        }
        if (runs.size() != 1) {
            return false;
        }
        Run run = runs.get(0);
        return run instanceof TextRun && ((TextRun) run).text.isEmpty();
    }

    @Override
    public String toString() {
        return "ParagraphBlock[" + id + ", runs=" + runs.size() + "]";
    }
}
