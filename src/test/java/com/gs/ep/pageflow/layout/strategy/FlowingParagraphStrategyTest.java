package com.gs.ep.pageflow.layout.strategy;

import com.gs.ep.pageflow.layout.PageState;
import com.gs.ep.pageflow.layout.ParagraphLayoutContext;
import com.gs.ep.pageflow.layout.ParagraphLayoutEngine;
import com.gs.ep.pageflow.layout.RecordingPageCursor;
import com.gs.ep.pageflow.layout.RecordingRemeasurer;
import com.gs.ep.pageflow.layout.StubFloatManager;
import com.gs.ep.pageflow.layout.TestParagraphs;
import com.gs.ep.pageflow.model.Line;
import com.gs.ep.pageflow.model.MarkerMeasure;
import com.gs.ep.pageflow.model.ParagraphBlock;
import com.gs.ep.pageflow.model.ParagraphMeasure;
import com.gs.ep.pageflow.model.attribute.FloatAlignment;
import com.gs.ep.pageflow.model.attribute.MarkerLayout;
import com.gs.ep.pageflow.model.attribute.ParagraphAttributes;
import com.gs.ep.pageflow.model.attribute.Spacing;
import com.gs.ep.pageflow.model.attribute.WordLayout;
import com.gs.ep.pageflow.model.fragment.Fragment;
import com.gs.ep.pageflow.model.fragment.ParagraphFragment;
import org.eclipse.collections.api.list.MutableList;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static com.gs.ep.pageflow.layout.TestParagraphs.context;
import static com.gs.ep.pageflow.layout.TestParagraphs.measure;
import static com.gs.ep.pageflow.layout.TestParagraphs.paragraph;
import static org.junit.jupiter.api.Assertions.*;

public class FlowingParagraphStrategyTest {

    private final ParagraphLayoutEngine engine = new ParagraphLayoutEngine();

    private static MutableList<ParagraphFragment> fragmentsOf(RecordingPageCursor cursor, String blockId) {
        return cursor.pages
                .flatCollect(page -> page.fragments)
                .select(fragment -> blockId.equals(fragment.getBlockId()))
                .collect(fragment -> (ParagraphFragment) fragment);
    }

    private static int pageOf(RecordingPageCursor cursor, Fragment fragment) {
        return cursor.pages.detect(page -> page.fragments.contains(fragment)).number;
    }

    // ==================== spacing ====================

    @Test
    void layout_contextualSpacingSameStyle_shouldSuppressBeforeAndUndoPreviousAfter() {
        RecordingPageCursor cursor = new RecordingPageCursor();
        cursor.startAt(100, 20, "Body", true);
        ParagraphBlock block = paragraph("p", ParagraphAttributes.builder()
                .styleId("Body").contextualSpacing(true).spacing(30, 20).build());

        engine.layoutParagraphBlock(context(block, measure(1, 20), cursor).build());

        PageState state = cursor.current();
        assertEquals(120.0, state.cursorY);
        assertEquals(20.0, state.trailingSpacing);
        assertEquals(80.0, fragmentsOf(cursor, "p").getFirst().getY());
    }

    @Test
    void layout_contextualSpacingAsStringFlag_shouldBeHonoured() {
        RecordingPageCursor cursor = new RecordingPageCursor();
        cursor.startAt(100, 20, "Body", true);
        ParagraphBlock block = paragraph("p", ParagraphAttributes.builder()
                .styleId("Body").contextualSpacing("1").spacing(30, 20).build());

        engine.layoutParagraphBlock(context(block, measure(1, 20), cursor).build());

        assertEquals(120.0, cursor.current().cursorY);
    }

    @Test
    void layout_differentStyles_shouldCollapseBeforeAgainstTrailing() {
        RecordingPageCursor cursor = new RecordingPageCursor();
        cursor.startAt(100, 20, "Heading1", true);
        ParagraphBlock block = paragraph("p", ParagraphAttributes.builder()
                .styleId("Body").contextualSpacing(true).spacing(30, 20).build());

        engine.layoutParagraphBlock(context(block, measure(1, 20), cursor).build());

        assertEquals(150.0, cursor.current().cursorY);
        assertEquals(110.0, fragmentsOf(cursor, "p").getFirst().getY());
    }

    @Test
    void layout_contextualSpacingWithEmptyStyleId_shouldCollapseNormally() {
        RecordingPageCursor cursor = new RecordingPageCursor();
        cursor.startAt(100, 20, "", true);
        ParagraphBlock block = paragraph("p", ParagraphAttributes.builder()
                .styleId("").contextualSpacing(true).spacing(30, 20).build());

        engine.layoutParagraphBlock(context(block, measure(1, 20), cursor).build());

        assertEquals(150.0, cursor.current().cursorY);
        assertEquals(110.0, fragmentsOf(cursor, "p").getFirst().getY());
    }

    @Test
    void layout_nonFiniteOrNegativeTrailing_shouldBehaveLikeZero() {
        double[] trailingValues = {Double.NaN, Double.POSITIVE_INFINITY, -10, 0};
        for (double trailing : trailingValues) {
            RecordingPageCursor cursor = new RecordingPageCursor();
            cursor.startAt(100, trailing, "Heading1", true);
            ParagraphBlock block = paragraph("p", ParagraphAttributes.builder()
                    .styleId("Body").spacing(30, 20).build());

            engine.layoutParagraphBlock(context(block, measure(1, 20), cursor).build());

            assertEquals(170.0, cursor.current().cursorY, "trailing " + trailing);
        }
    }

    @Test
    void layout_contextualSpacingWithNaNTrailing_shouldNotMoveCursorBack() {
        RecordingPageCursor cursor = new RecordingPageCursor();
        cursor.startAt(100, Double.NaN, "Body", true);
        ParagraphBlock block = paragraph("p", ParagraphAttributes.builder()
                .styleId("Body").contextualSpacing(true).spacing(10, 10).build());

        engine.layoutParagraphBlock(context(block, measure(1, 20), cursor).build());

        assertEquals(130.0, cursor.current().cursorY);
    }

    @Test
    void layout_legacyLineSpaceKeys_shouldBeUsedWhenBeforeAndAfterAbsent() {
        RecordingPageCursor cursor = new RecordingPageCursor();
        ParagraphBlock block = paragraph("p", ParagraphAttributes.builder()
                .spacing(new Spacing(null, null, 15.0, 5.0)).build());

        engine.layoutParagraphBlock(context(block, measure(1, 20), cursor).build());

        assertEquals(115.0, fragmentsOf(cursor, "p").getFirst().getY());
        assertEquals(140.0, cursor.current().cursorY);
        assertEquals(5.0, cursor.current().trailingSpacing);
    }

    @Test
    void layout_overrideSpacingAfter_shouldReplaceResolvedAfter() {
        RecordingPageCursor cursor = new RecordingPageCursor();
        ParagraphBlock block = paragraph("p", ParagraphAttributes.builder().spacing(0, 20).build());

        engine.layoutParagraphBlock(context(block, measure(1, 20), cursor).overrideSpacingAfter(0.0).build());

        assertEquals(120.0, cursor.current().cursorY);
        assertEquals(0.0, cursor.current().trailingSpacing);
    }

    @Test
    void layout_spacingLargerThanContentArea_shouldBeSkippedOnFreshPage() {
        RecordingPageCursor cursor = new RecordingPageCursor();
        ParagraphBlock block = paragraph("p", ParagraphAttributes.builder().spacing(2000, 0).build());

        engine.layoutParagraphBlock(context(block, measure(1, 20), cursor).build());

        assertEquals(0, cursor.advanceCalls);
        assertEquals(100.0, fragmentsOf(cursor, "p").getFirst().getY());
        assertEquals(120.0, cursor.current().cursorY);
    }

    @Test
    void layout_spacingLargerThanContentAreaMidPage_shouldAdvanceOnceThenSkip() {
        RecordingPageCursor cursor = new RecordingPageCursor();
        cursor.startAt(300, 0, null, true);
        ParagraphBlock block = paragraph("p", ParagraphAttributes.builder().spacing(2000, 0).build());

        engine.layoutParagraphBlock(context(block, measure(1, 20), cursor).build());

        assertEquals(1, cursor.advanceCalls);
        ParagraphFragment fragment = fragmentsOf(cursor, "p").getFirst();
        assertEquals(2, pageOf(cursor, fragment));
        assertEquals(100.0, fragment.getY());
    }

    @Test
    void layout_spacingAfterNotFitting_shouldAdvanceAndCarryNothing() {
        RecordingPageCursor cursor = new RecordingPageCursor();
        cursor.startAt(770, 0, null, true);
        ParagraphBlock block = paragraph("p", ParagraphAttributes.builder().styleId("Body").spacing(0, 20).build());

        engine.layoutParagraphBlock(context(block, measure(1, 20), cursor).build());

        assertEquals(1, cursor.advanceCalls);
        PageState next = cursor.current();
        assertEquals(2, next.page.number);
        assertEquals(100.0, next.cursorY);
        assertEquals(0.0, next.trailingSpacing);
        assertEquals(2, cursor.pages.get(0).fragments.size());
        assertTrue(cursor.pages.get(1).fragments.isEmpty());
    }

    @Test
    void layout_spacingAfterFitting_shouldBeCarriedAsTrailing() {
        RecordingPageCursor cursor = new RecordingPageCursor();
        ParagraphBlock block = paragraph("p", ParagraphAttributes.builder().styleId("Body").spacing(0, 12).build());

        engine.layoutParagraphBlock(context(block, measure(2, 20), cursor).build());

        PageState state = cursor.current();
        assertEquals(152.0, state.cursorY);
        assertEquals(12.0, state.trailingSpacing);
        assertEquals("Body", state.lastParagraphStyleId);
    }

    @Test
    void layout_emptyParagraphWithoutExplicitSpacing_shouldSuppressInheritedSpacing() {
        RecordingPageCursor cursor = new RecordingPageCursor();
        ParagraphBlock block = new ParagraphBlock("empty", Collections.emptyList(),
                ParagraphAttributes.builder().spacing(10, 10).build());

        engine.layoutParagraphBlock(context(block, new ParagraphMeasure(Collections.emptyList(), 18), cursor).build());

        ParagraphFragment fragment = fragmentsOf(cursor, "empty").getFirst();
        assertEquals(100.0, fragment.getY());
        assertEquals(0, fragment.getFromLine());
        assertEquals(1, fragment.getToLine());
        assertEquals(118.0, cursor.current().cursorY);
        assertEquals(0.0, cursor.current().trailingSpacing);
    }

    @Test
    void layout_emptyParagraphWithExplicitBefore_shouldKeepOnlyBefore() {
        RecordingPageCursor cursor = new RecordingPageCursor();
        ParagraphBlock block = new ParagraphBlock("empty", Collections.emptyList(),
                ParagraphAttributes.builder().spacing(10, 10).spacingExplicit(true, false).build());

        engine.layoutParagraphBlock(context(block, new ParagraphMeasure(Collections.emptyList(), 18), cursor).build());

        assertEquals(110.0, fragmentsOf(cursor, "empty").getFirst().getY());
        assertEquals(128.0, cursor.current().cursorY);
    }

    // ==================== slicing ====================

    @Test
    void layout_paragraphTallerThanPage_shouldPartitionLinesAcrossPages() {
        RecordingPageCursor cursor = new RecordingPageCursor();
        ParagraphBlock block = paragraph("p", ParagraphAttributes.EMPTY);

        engine.layoutParagraphBlock(context(block, measure(10, 100), cursor).build());

        MutableList<ParagraphFragment> fragments = fragmentsOf(cursor, "p");
        assertEquals(2, fragments.size());
        int expectedFrom = 0;
        for (ParagraphFragment fragment : fragments) {
            assertEquals(expectedFrom, fragment.getFromLine());
            assertTrue(fragment.getToLine() > fragment.getFromLine());
            expectedFrom = fragment.getToLine();
        }
        assertEquals(10, expectedFrom);

        ParagraphFragment first = fragments.get(0);
        ParagraphFragment second = fragments.get(1);
        assertEquals(7, first.getToLine());
        assertFalse(first.isContinuesFromPrev());
        assertTrue(first.isContinuesOnNext());
        assertTrue(second.isContinuesFromPrev());
        assertFalse(second.isContinuesOnNext());
        assertEquals(1, pageOf(cursor, first));
        assertEquals(2, pageOf(cursor, second));
        assertEquals(100.0, second.getY());
    }

    @Test
    void layout_lineTallerThanRemainingSpace_shouldStartOnNextPage() {
        RecordingPageCursor cursor = new RecordingPageCursor();
        cursor.startAt(790, 0, null, true);
        ParagraphBlock block = paragraph("p", ParagraphAttributes.EMPTY);

        engine.layoutParagraphBlock(context(block, measure(1, 20), cursor).build());

        ParagraphFragment fragment = fragmentsOf(cursor, "p").getFirst();
        assertEquals(2, pageOf(cursor, fragment));
        assertEquals(100.0, fragment.getY());
    }

    @Test
    void layout_lineTallerThanBlankPage_shouldStillBePlaced() {
        RecordingPageCursor cursor = new RecordingPageCursor();
        ParagraphBlock block = paragraph("p", ParagraphAttributes.EMPTY);

        engine.layoutParagraphBlock(context(block, measure(1, 900), cursor).build());

        ParagraphFragment fragment = fragmentsOf(cursor, "p").getFirst();
        assertEquals(1, pageOf(cursor, fragment));
        assertEquals(0, cursor.advanceCalls);
        assertEquals(1000.0, cursor.current().cursorY);
    }

    @Test
    void layout_splitParagraph_shouldTrackPmRangePerFragment() {
        RecordingPageCursor cursor = new RecordingPageCursor();
        ParagraphBlock block = paragraph("p", ParagraphAttributes.EMPTY);

        engine.layoutParagraphBlock(context(block, measure(4, 200), cursor).build());

        MutableList<ParagraphFragment> fragments = fragmentsOf(cursor, "p");
        assertEquals(Integer.valueOf(10), fragments.get(0).getPmStart());
        assertEquals(Integer.valueOf(40), fragments.get(0).getPmEnd());
        assertEquals(Integer.valueOf(40), fragments.get(1).getPmStart());
        assertEquals(Integer.valueOf(50), fragments.get(1).getPmEnd());
    }

    @Test
    void layout_markerFields_shouldOnlyBeSetOnFirstFragment() {
        RecordingPageCursor cursor = new RecordingPageCursor();
        ParagraphBlock block = paragraph("p", ParagraphAttributes.EMPTY);
        MarkerMeasure marker = new MarkerMeasure(18.0, 10.0, 6.0, 36);

        engine.layoutParagraphBlock(context(block, measure(10, 100, marker), cursor).build());

        MutableList<ParagraphFragment> fragments = fragmentsOf(cursor, "p");
        assertEquals(Double.valueOf(18.0), fragments.get(0).getMarkerWidth());
        assertEquals(Double.valueOf(10.0), fragments.get(0).getMarkerTextWidth());
        assertEquals(Double.valueOf(6.0), fragments.get(0).getMarkerGutter());
        assertNull(fragments.get(1).getMarkerWidth());
        assertNull(fragments.get(1).getMarkerGutter());
    }

    @Test
    void layout_negativeIndents_shouldShiftAndWidenFragment() {
        RecordingPageCursor cursor = new RecordingPageCursor();
        ParagraphBlock block = paragraph("p", ParagraphAttributes.builder().indent(-48.0, -72.0).build());

        engine.layoutParagraphBlock(context(block, measure(1, 20), cursor).build());

        ParagraphFragment fragment = fragmentsOf(cursor, "p").getFirst();
        assertEquals(2.0, fragment.getX());
        assertEquals(720.0, fragment.getWidth());
    }

    @Test
    void layout_positiveIndents_shouldLeaveFragmentBoxAtColumn() {
        RecordingPageCursor cursor = new RecordingPageCursor();
        ParagraphBlock block = paragraph("p", ParagraphAttributes.builder().indent(36.0, 12.0).build());

        engine.layoutParagraphBlock(context(block, measure(1, 20), cursor).build());

        ParagraphFragment fragment = fragmentsOf(cursor, "p").getFirst();
        assertEquals(50.0, fragment.getX());
        assertEquals(600.0, fragment.getWidth());
    }

    @Test
    void layout_floatAlignmentRight_shouldAlignWidestLineToColumnEdge() {
        RecordingPageCursor cursor = new RecordingPageCursor();
        ParagraphBlock block = paragraph("p", ParagraphAttributes.builder().floatAlignment(FloatAlignment.RIGHT).build());

        engine.layoutParagraphBlock(context(block, measure(2, 20), cursor).build());

        assertEquals(550.0, fragmentsOf(cursor, "p").getFirst().getX());
    }

    @Test
    void layout_floatAlignmentCenter_shouldCentreWidestLine() {
        RecordingPageCursor cursor = new RecordingPageCursor();
        ParagraphBlock block = paragraph("p", ParagraphAttributes.builder().floatAlignment(FloatAlignment.CENTER).build());

        engine.layoutParagraphBlock(context(block, measure(2, 20), cursor).build());

        assertEquals(300.0, fragmentsOf(cursor, "p").getFirst().getX());
    }

    // ==================== keep lines ====================

    @Test
    void layout_keepLinesWithOnly100pxRemaining_shouldAdvanceOnce() {
        RecordingPageCursor cursor = new RecordingPageCursor();
        cursor.startAt(700, 0, null, true);
        ParagraphBlock block = paragraph("p", ParagraphAttributes.builder().keepLines(true).build());

        engine.layoutParagraphBlock(context(block, measure(3, 50), cursor).build());

        assertEquals(1, cursor.advanceCalls);
        MutableList<ParagraphFragment> fragments = fragmentsOf(cursor, "p");
        assertEquals(1, fragments.size());
        assertEquals(2, pageOf(cursor, fragments.getFirst()));
        assertEquals(3, fragments.getFirst().getToLine());
        assertEquals(100.0, fragments.getFirst().getY());
    }

    @Test
    void layout_keepLinesWith700pxRemaining_shouldNotAdvance() {
        RecordingPageCursor cursor = new RecordingPageCursor();
        cursor.startAt(100, 0, null, true);
        ParagraphBlock block = paragraph("p", ParagraphAttributes.builder().keepLines(true).build());

        engine.layoutParagraphBlock(context(block, measure(3, 50), cursor).build());

        assertEquals(0, cursor.advanceCalls);
        assertEquals(1, pageOf(cursor, fragmentsOf(cursor, "p").getFirst()));
    }

    @Test
    void layout_keepLinesTallerThanBlankPage_shouldStartOnCurrentPage() {
        RecordingPageCursor cursor = new RecordingPageCursor();
        cursor.startAt(700, 0, null, true);
        ParagraphBlock block = paragraph("p", ParagraphAttributes.builder().keepLines(true).build());

        engine.layoutParagraphBlock(context(block, measure(15, 50), cursor).build());

        ParagraphFragment first = fragmentsOf(cursor, "p").getFirst();
        assertEquals(1, pageOf(cursor, first));
        assertEquals(0, first.getFromLine());
        assertEquals(2, first.getToLine());
    }

    @Test
    void layout_keepLinesOnEmptyPage_shouldNotAdvance() {
        RecordingPageCursor cursor = new RecordingPageCursor();
        cursor.startAt(700, 0, null, false);
        ParagraphBlock block = paragraph("p", ParagraphAttributes.builder().keepLines(true).build());

        engine.layoutParagraphBlock(context(block, measure(3, 50), cursor).build());

        ParagraphFragment first = fragmentsOf(cursor, "p").getFirst();
        assertEquals(1, pageOf(cursor, first));
        assertEquals(700.0, first.getY());
    }

    @Test
    void layout_keepLinesBlankPageCheck_shouldUseUncollapsedSpacingBefore() {
        RecordingPageCursor cursor = new RecordingPageCursor();
        cursor.startAt(600, 100, null, true);
        ParagraphBlock block = paragraph("p", ParagraphAttributes.builder().keepLines(true).spacing(100, 0).build());

        engine.layoutParagraphBlock(context(block, measure(13, 50), cursor).build());

        ParagraphFragment first = fragmentsOf(cursor, "p").getFirst();
        assertEquals(1, pageOf(cursor, first));
        assertEquals(600.0, first.getY());
        assertEquals(4, first.getToLine());
    }

    // ==================== remeasure ====================

    @Test
    void layout_floatsNarrowSomeBands_shouldRemeasureOnceAtNarrowestWidth() {
        RecordingPageCursor cursor = new RecordingPageCursor();
        StubFloatManager floats = new StubFloatManager()
                .narrow(120, 140, 300, 0)
                .narrow(140, 160, 120, 480);
        RecordingRemeasurer remeasurer = new RecordingRemeasurer(measure(6, 20));
        ParagraphBlock block = paragraph("p", ParagraphAttributes.builder()
                .wordLayout(new WordLayout(new MarkerLayout(18.0), true)).build());
        ParagraphMeasure original = measure(4, 20, new MarkerMeasure(18.0, 10.0, 6.0, 0));

        engine.layoutParagraphBlock(context(block, original, cursor)
                .floatManager(floats).remeasurer(remeasurer).build());

        assertEquals(1, remeasurer.calls());
        assertSame(block, remeasurer.blocks.getFirst());
        assertEquals(120.0, remeasurer.maxWidths.getFirst());
        assertEquals(24.0, remeasurer.firstLineIndents.getFirst());
        assertEquals(4, floats.queriedLineYs.size());

        ParagraphFragment fragment = fragmentsOf(cursor, "p").getFirst();
        assertEquals(6, fragment.getToLine());
        assertEquals(530.0, fragment.getX());
        assertEquals(120.0, fragment.getWidth());
        assertNull(fragment.getLines());
        assertEquals(Double.valueOf(18.0), fragment.getMarkerWidth());
    }

    @Test
    void layout_noFloatOverlap_shouldNotRemeasure() {
        RecordingPageCursor cursor = new RecordingPageCursor();
        RecordingRemeasurer remeasurer = new RecordingRemeasurer(measure(6, 20));
        ParagraphBlock block = paragraph("p", ParagraphAttributes.EMPTY);

        engine.layoutParagraphBlock(context(block, measure(4, 20), cursor).remeasurer(remeasurer).build());

        assertEquals(0, remeasurer.calls());
        assertEquals(4, fragmentsOf(cursor, "p").getFirst().getToLine());
    }

    @Test
    void layout_measuredWiderThanColumn_shouldRemeasureAtFullColumnWidth() {
        RecordingPageCursor cursor = new RecordingPageCursor();
        List<Line> remeasuredLines = TestParagraphs.lines(5, 20, 500, 600.0);
        RecordingRemeasurer remeasurer = new RecordingRemeasurer(
                ParagraphMeasure.ofLines(remeasuredLines, new MarkerMeasure(18.0, 12.5, 6.0, 0)));
        ParagraphBlock block = paragraph("p", ParagraphAttributes.builder().indent(24.0, 0.0).build());
        ParagraphMeasure wide = ParagraphMeasure.ofLines(TestParagraphs.lines(3, 20, 700, 800.0), null);

        engine.layoutParagraphBlock(context(block, wide, cursor).remeasurer(remeasurer).build());

        assertEquals(1, remeasurer.calls());
        assertEquals(600.0, remeasurer.maxWidths.getFirst());
        assertEquals(0.0, remeasurer.firstLineIndents.getFirst());
        ParagraphFragment fragment = fragmentsOf(cursor, "p").getFirst();
        assertEquals(5, fragment.getToLine());
        assertEquals(remeasuredLines, fragment.getLines());
        assertEquals(Double.valueOf(12.5), fragment.getMarkerTextWidth());
    }

    @Test
    void layout_measuredWiderThanColumnWithoutRemeasurer_shouldUseStaleLines() {
        RecordingPageCursor cursor = new RecordingPageCursor();
        ParagraphBlock block = paragraph("p", ParagraphAttributes.EMPTY);
        ParagraphMeasure wide = ParagraphMeasure.ofLines(TestParagraphs.lines(3, 20, 700, 800.0), null);

        engine.layoutParagraphBlock(context(block, wide, cursor).build());

        ParagraphFragment fragment = fragmentsOf(cursor, "p").getFirst();
        assertEquals(3, fragment.getToLine());
        assertNull(fragment.getLines());
    }

    @Test
    void layout_floatScan_shouldUseSpacingEstimateBeforeContextualCollapse() {
        RecordingPageCursor cursor = new RecordingPageCursor();
        cursor.startAt(100, 20, "Body", true);
        StubFloatManager floats = new StubFloatManager();
        ParagraphBlock block = paragraph("p", ParagraphAttributes.builder()
                .styleId("Body").contextualSpacing(true).spacing(30, 0).build());

        engine.layoutParagraphBlock(context(block, measure(1, 20), cursor)
                .floatManager(floats).remeasurer(new RecordingRemeasurer(measure(1, 20))).build());

        assertEquals(110.0, floats.queriedLineYs.getFirst());
        assertEquals(80.0, fragmentsOf(cursor, "p").getFirst().getY());
    }

    // ==================== state ====================

    @Test
    void layout_sameSnapshotTwice_shouldProduceIdenticalFragmentsAndCursor() {
        PageState snapshot = new RecordingPageCursor().startAt(300, 12, "Body", true).copy();
        ParagraphBlock block = paragraph("p", ParagraphAttributes.builder().styleId("Body").spacing(20, 10).build());
        ParagraphMeasure measure = measure(12, 60);

        RecordingPageCursor first = RecordingPageCursor.resumingFrom(snapshot);
        RecordingPageCursor second = RecordingPageCursor.resumingFrom(snapshot);
        ParagraphLayoutContext firstCtx = context(block, measure, first).build();
        ParagraphLayoutContext secondCtx = context(block, measure, second).build();
        engine.layoutParagraphBlock(firstCtx);
        engine.layoutParagraphBlock(secondCtx);

        assertEquals(first.pages.flatCollect(page -> page.fragments), second.pages.flatCollect(page -> page.fragments));
        assertEquals(first.current().cursorY, second.current().cursorY);
        assertEquals(first.current().trailingSpacing, second.current().trailingSpacing);
        assertEquals(1, snapshot.page.fragments.size());
        assertEquals(300.0, snapshot.cursorY);
    }
}
