package com.gs.ep.pageflow.layout;

import com.gs.ep.pageflow.layout.floats.ExclusionZone;
import com.gs.ep.pageflow.model.AnchoredBlock;
import com.gs.ep.pageflow.model.ObjectMeasure;

import java.util.List;

/**
 * Tracks anchored images/drawings and answers width queries for text bands.
 * Queries must be idempotent: layout asks once per line while scanning and may discard answers.
 */
public interface FloatingObjectManager {

    AvailableWidth computeAvailableWidth(double lineY, double lineHeight, double columnWidth,
                                         int columnIndex, int pageNumber);

    /**
     * Registers a placed object as an exclusion for later lines on the same page and column.
     * The horizontal position is resolved from the object's anchor against the manager's
     * layout context.
     */
    void registerDrawing(AnchoredBlock block, ObjectMeasure measure, double anchorY, int columnIndex, int pageNumber);

    List<ExclusionZone> getExclusionsForLine(double lineY, double lineHeight, int columnIndex, int pageNumber);

    void clear();
}
