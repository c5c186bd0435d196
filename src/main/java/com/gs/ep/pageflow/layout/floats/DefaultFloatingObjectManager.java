package com.gs.ep.pageflow.layout.floats;

import com.gs.ep.pageflow.layout.AvailableWidth;
import com.gs.ep.pageflow.layout.FloatingObjectManager;
import com.gs.ep.pageflow.layout.anchor.AnchorPositionResolver;
import com.gs.ep.pageflow.model.AnchoredBlock;
import com.gs.ep.pageflow.model.Columns;
import com.gs.ep.pageflow.model.ObjectMeasure;
import com.gs.ep.pageflow.model.PageMargins;
import com.gs.ep.pageflow.model.attribute.ImageWrap;
import com.gs.ep.pageflow.model.attribute.WrapText;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Exclusion-zone based float manager. Objects whose wrap lets text flow beside them narrow the
 * lines they overlap; objects that do not wrap text beside them (top-and-bottom, none, inline) or
 * sit behind the text are ignored.
 *
 * <p>A zone centred in the left half of its column pushes text to the right of it, otherwise text
 * stays on its left, unless the wrap pins text to one side.
 */
public class DefaultFloatingObjectManager implements FloatingObjectManager {
    private static final Logger LOGGER = LoggerFactory.getLogger(DefaultFloatingObjectManager.class);

    private final MutableList<ExclusionZone> zones = Lists.mutable.empty();
    private Columns columns;
    private PageMargins margins;
    private double pageWidth;

    public DefaultFloatingObjectManager(Columns columns, PageMargins margins, double pageWidth) {
        setLayoutContext(columns, margins, pageWidth);
    }

    /**
     * Updates the geometry used to resolve anchors, e.g. when a new section changes columns.
     */
    public void setLayoutContext(Columns columns, PageMargins margins, double pageWidth) {
        this.columns = columns;
        this.margins = margins;
        this.pageWidth = pageWidth;
    }

    @Override
    public AvailableWidth computeAvailableWidth(double lineY, double lineHeight, double columnWidth,
                                                int columnIndex, int pageNumber) {
        List<ExclusionZone> overlapping = getExclusionsForLine(lineY, lineHeight, columnIndex, pageNumber);
        if (overlapping.isEmpty()) {
            return AvailableWidth.full(columnWidth);
        }

        double columnLeft = columnLeft(columnIndex);
        double left = 0;
        double right = columnWidth;
        for (ExclusionZone zone : overlapping) {
            double zoneLeft = zone.left - columnLeft;
            double zoneRight = zone.right - columnLeft;
            if (zoneRight <= 0 || zoneLeft >= columnWidth) {
                continue;
            }
            if (takesLeftSide(zone.wrapText, zoneLeft, zoneRight, columnWidth)) {
                left = Math.max(left, zoneRight);
            } else {
                right = Math.min(right, zoneLeft);
            }
        }
        AvailableWidth available = new AvailableWidth(Math.max(0, right - left), left);
        LOGGER.trace("Line band y={} h={} on page {} column {} narrowed to {}",
                lineY, lineHeight, pageNumber, columnIndex, available);
        return available;
    }

    @Override
    public void registerDrawing(AnchoredBlock block, ObjectMeasure measure, double anchorY,
                                int columnIndex, int pageNumber) {
        ImageWrap wrap = block.wrap;
        if (block.isBehindDoc() || !wrap.type.narrowsText()) {
            LOGGER.trace("Anchored {} does not displace text (wrap={}, behindDoc={})",
                    block.id, wrap.type, block.isBehindDoc());
            return;
        }

        double x = block.anchor != null
                ? AnchorPositionResolver.computeAnchorX(block.anchor, columnIndex, columns, measure.width,
                        margins, pageWidth)
                : columnLeft(columnIndex);

        ExclusionZone zone = new ExclusionZone(block.id, pageNumber, columnIndex,
                x - wrap.distLeft, x + measure.width + wrap.distRight,
                anchorY - wrap.distTop, anchorY + measure.height + wrap.distBottom,
                wrap.wrapText);
        zones.removeAll(zones.select(existing -> existing.blockId.equals(block.id)));
        zones.add(zone);
        LOGGER.debug("Registered {}", zone);
    }

    @Override
    public List<ExclusionZone> getExclusionsForLine(double lineY, double lineHeight, int columnIndex, int pageNumber) {
        return zones.select(zone -> zone.appliesTo(pageNumber, columnIndex) && zone.overlapsBand(lineY, lineHeight));
    }

    @Override
    public void clear() {
        zones.clear();
    }

    private double columnLeft(int columnIndex) {
        return margins.left + columnIndex * (columns.width + columns.gap);
    }

    private static boolean takesLeftSide(WrapText wrapText, double zoneLeft, double zoneRight, double columnWidth) {
        switch (wrapText) {
            case RIGHT:
                return true;
            case LEFT:
                return false;
            default:
                return (zoneLeft + zoneRight) / 2 < columnWidth / 2;
        }
    }
}
