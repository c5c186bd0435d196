package com.gs.ep.pageflow.layout;

import com.gs.ep.pageflow.model.AnchoredBlock;
import com.gs.ep.pageflow.model.ObjectMeasure;

/**
 * An anchored image or drawing attached to a paragraph, with its measured size.
 */
public class AnchoredDrawingEntry {
    public final AnchoredBlock block;
    public final ObjectMeasure measure;

    public AnchoredDrawingEntry(AnchoredBlock block, ObjectMeasure measure) {
        this.block = block;
        this.measure = measure;
    }
}
