package com.gs.ep.pageflow.layout.anchor;

import com.gs.ep.pageflow.layout.AnchoredDrawingEntry;
import com.gs.ep.pageflow.layout.LayoutUtils;
import com.gs.ep.pageflow.layout.PageState;
import com.gs.ep.pageflow.layout.ParagraphAnchorsContext;
import com.gs.ep.pageflow.layout.ParagraphLayoutContext;
import com.gs.ep.pageflow.layout.PmRange;
import com.gs.ep.pageflow.model.AnchoredBlock;
import com.gs.ep.pageflow.model.BlockKind;
import com.gs.ep.pageflow.model.DrawingBlock;
import com.gs.ep.pageflow.model.DrawingMeasure;
import com.gs.ep.pageflow.model.ObjectMeasure;
import com.gs.ep.pageflow.model.attribute.HorizontalRelativeFrom;
import com.gs.ep.pageflow.model.fragment.DrawingFragment;
import com.gs.ep.pageflow.model.fragment.ImageFragment;
import com.gs.ep.pageflow.model.fragment.ImageFragmentMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Places the anchored images and drawings attached to a paragraph before its text flows, so
 * their exclusion zones are known when the paragraph's lines are measured against floats.
 *
 * <p>Placement does not move the text cursor. Each object is placed at most once per document.
 */
public class AnchoredObjectPlacer {
    private static final Logger LOGGER = LoggerFactory.getLogger(AnchoredObjectPlacer.class);

    static final double MIN_IMAGE_WIDTH = 20;

    public void placeAll(ParagraphLayoutContext ctx, ParagraphAnchorsContext anchors) {
        if (anchors == null || !anchors.hasDrawings()) {
            return;
        }
        double firstLineHeight = ctx.measure.lines.isEmpty() ? 0 : ctx.measure.lines.get(0).safeLineHeight();

        for (AnchoredDrawingEntry entry : anchors.anchoredDrawings) {
            if (anchors.placedAnchoredIds.contains(entry.block.id)) {
                continue;
            }
            PageState state = ctx.cursor.ensurePage();
            AnchoredBlock block = entry.block;
            ObjectMeasure measure = entry.measure;

            double anchorY = AnchorPositionResolver.computeAnchorY(
                    block.anchor, measure.height, state, firstLineHeight, anchors.pageMargins.bottom);
            ctx.floatManager.registerDrawing(block, measure, anchorY, state.columnIndex, state.page.number);

            double anchorX = block.anchor != null
                    ? AnchorPositionResolver.computeAnchorX(block.anchor, state.columnIndex, anchors.columns,
                            measure.width, anchors.pageMargins, anchors.pageWidth)
                    : ctx.cursor.columnX(state.columnIndex);

            PmRange pmRange = LayoutUtils.extractBlockPmRange(block);
            int zIndex = block.isBehindDoc() ? 0 : 1;

            if (block.getKind() == BlockKind.IMAGE && measure.getKind() == BlockKind.IMAGE) {
                ImageFragmentMetadata metadata = imageMetadata(block, measure, state, anchors);
                state.page.fragments.add(new ImageFragment(block.id, anchorX, anchorY, measure.width, measure.height,
                        zIndex, metadata, pmRange.pmStart, pmRange.pmEnd));
            } else if (block.getKind() == BlockKind.DRAWING && measure.getKind() == BlockKind.DRAWING) {
                DrawingBlock drawing = (DrawingBlock) block;
                DrawingMeasure drawingMeasure = (DrawingMeasure) measure;
                state.page.fragments.add(new DrawingFragment(block.id, drawing.drawingKind, anchorX, anchorY,
                        measure.width, measure.height, zIndex, drawingMeasure.geometry, drawingMeasure.scale,
                        drawing.drawingContentId, pmRange.pmStart, pmRange.pmEnd));
            } else {
                LOGGER.warn("Anchored block {} has kind {} but measure kind {}, no fragment emitted",
                        block.id, block.getKind(), measure.getKind());
            }

            anchors.placedAnchoredIds.add(block.id);
            LOGGER.debug("Placed anchored {} {} at ({}, {}) on page {} column {}",
                    block.getKind(), block.id, anchorX, anchorY, state.page.number, state.columnIndex);
        }
    }

    private ImageFragmentMetadata imageMetadata(AnchoredBlock block, ObjectMeasure measure, PageState state,
                                                ParagraphAnchorsContext anchors) {
        double contentHeight = Math.max(0, state.contentBottom - state.topMargin);
        HorizontalRelativeFrom relativeFrom = block.anchor == null || block.anchor.hRelativeFrom == null
                ? HorizontalRelativeFrom.COLUMN
                : block.anchor.hRelativeFrom;
        double marginWidth = anchors.pageWidth - anchors.pageMargins.left - anchors.pageMargins.right;

        double maxWidth;
        switch (relativeFrom) {
            case PAGE:
                maxWidth = anchors.columns.count == 1 ? marginWidth : anchors.pageWidth;
                break;
            case MARGIN:
                maxWidth = marginWidth;
                break;
            case COLUMN:
            default:
                maxWidth = anchors.columns.width;
                break;
        }

        double aspectRatio = measure.width > 0 && measure.height > 0 ? measure.width / measure.height : 1.0;
        return new ImageFragmentMetadata(measure.width, measure.height, maxWidth, contentHeight,
                aspectRatio, MIN_IMAGE_WIDTH, MIN_IMAGE_WIDTH / aspectRatio);
    }
}
