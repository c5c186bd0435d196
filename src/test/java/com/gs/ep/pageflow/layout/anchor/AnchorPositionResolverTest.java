package com.gs.ep.pageflow.layout.anchor;

import com.gs.ep.pageflow.layout.Page;
import com.gs.ep.pageflow.layout.PageState;
import com.gs.ep.pageflow.model.Columns;
import com.gs.ep.pageflow.model.PageMargins;
import com.gs.ep.pageflow.model.attribute.HorizontalAlign;
import com.gs.ep.pageflow.model.attribute.HorizontalRelativeFrom;
import com.gs.ep.pageflow.model.attribute.ImageAnchor;
import com.gs.ep.pageflow.model.attribute.VerticalAlign;
import com.gs.ep.pageflow.model.attribute.VerticalRelativeFrom;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class AnchorPositionResolverTest {

    private static final PageMargins MARGINS = new PageMargins(96, 96, 96, 96);
    private static final double PAGE_WIDTH = 816;
    private static final Columns TWO_COLUMNS = Columns.split(624, 2, 24);

    private static ImageAnchor horizontal(HorizontalRelativeFrom relativeFrom, HorizontalAlign align, Double offset) {
        return new ImageAnchor(relativeFrom, null, align, null, offset, null, false);
    }

    private static ImageAnchor vertical(VerticalRelativeFrom relativeFrom, VerticalAlign align, Double offset) {
        return new ImageAnchor(null, relativeFrom, null, align, null, offset, false);
    }

    private static PageState stateAt(double cursorY) {
        PageState state = new PageState(new Page(1), 0, 96, 960);
        state.cursorY = cursorY;
        return state;
    }

    @Test
    void computeAnchorX_columnWithOffset_shouldStartAtColumnLeft() {
        double x = AnchorPositionResolver.computeAnchorX(horizontal(HorizontalRelativeFrom.COLUMN, null, 10.0),
                1, TWO_COLUMNS, 100, MARGINS, PAGE_WIDTH);

        assertEquals(430.0, x);
    }

    @Test
    void computeAnchorX_pageRight_shouldAlignToPageEdge() {
        double x = AnchorPositionResolver.computeAnchorX(horizontal(HorizontalRelativeFrom.PAGE, HorizontalAlign.RIGHT, 40.0),
                0, TWO_COLUMNS, 100, MARGINS, PAGE_WIDTH);

        assertEquals(716.0, x);
    }

    @Test
    void computeAnchorX_marginCenter_shouldCentreInContentBox() {
        double x = AnchorPositionResolver.computeAnchorX(horizontal(HorizontalRelativeFrom.MARGIN, HorizontalAlign.CENTER, null),
                1, TWO_COLUMNS, 100, MARGINS, PAGE_WIDTH);

        assertEquals(358.0, x);
    }

    @Test
    void computeAnchorX_noRelativeFromAndNaNOffset_shouldUseColumnLeft() {
        double x = AnchorPositionResolver.computeAnchorX(horizontal(null, null, Double.NaN),
                0, TWO_COLUMNS, 100, MARGINS, PAGE_WIDTH);

        assertEquals(96.0, x);
    }

    @Test
    void computeAnchorY_noAnchorOrRelativeFrom_shouldFollowCursor() {
        assertEquals(300.0, AnchorPositionResolver.computeAnchorY(null, 50, stateAt(300), 20, 96));
        assertEquals(312.0, AnchorPositionResolver.computeAnchorY(vertical(null, null, 12.0), 50, stateAt(300), 20, 96));
    }

    @Test
    void computeAnchorY_marginBottom_shouldAlignToContentBottom() {
        double y = AnchorPositionResolver.computeAnchorY(vertical(VerticalRelativeFrom.MARGIN, VerticalAlign.BOTTOM, null),
                100, stateAt(300), 20, 96);

        assertEquals(860.0, y);
    }

    @Test
    void computeAnchorY_pageCenter_shouldUsePhysicalPageHeight() {
        double y = AnchorPositionResolver.computeAnchorY(vertical(VerticalRelativeFrom.PAGE, VerticalAlign.CENTER, null),
                56, stateAt(300), 20, 96);

        assertEquals(500.0, y);
    }

    @Test
    void computeAnchorY_pageWithoutAlign_shouldOffsetFromPageTop() {
        double y = AnchorPositionResolver.computeAnchorY(vertical(VerticalRelativeFrom.PAGE, null, 50.0),
                56, stateAt(300), 20, 96);

        assertEquals(50.0, y);
    }

    @Test
    void computeAnchorY_paragraphCenter_shouldCentreOnFirstLine() {
        double y = AnchorPositionResolver.computeAnchorY(vertical(VerticalRelativeFrom.PARAGRAPH, VerticalAlign.CENTER, 4.0),
                10, stateAt(300), 20, 96);

        assertEquals(309.0, y);
    }
}
