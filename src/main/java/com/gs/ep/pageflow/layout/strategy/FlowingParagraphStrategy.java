package com.gs.ep.pageflow.layout.strategy;

import com.gs.ep.pageflow.layout.AbstractParagraphLayoutStrategy;
import com.gs.ep.pageflow.layout.AvailableWidth;
import com.gs.ep.pageflow.layout.LayoutNumbers;
import com.gs.ep.pageflow.layout.LayoutUtils;
import com.gs.ep.pageflow.layout.LineSlice;
import com.gs.ep.pageflow.layout.MarkerIndents;
import com.gs.ep.pageflow.layout.PageCursor;
import com.gs.ep.pageflow.layout.PageState;
import com.gs.ep.pageflow.layout.ParagraphLayoutContext;
import com.gs.ep.pageflow.layout.ParagraphLines;
import com.gs.ep.pageflow.layout.ParagraphType;
import com.gs.ep.pageflow.layout.PmRange;
import com.gs.ep.pageflow.layout.ResolvedSpacing;
import com.gs.ep.pageflow.model.ParagraphMeasure;
import com.gs.ep.pageflow.model.attribute.FloatAlignment;
import com.gs.ep.pageflow.model.attribute.Indent;
import com.gs.ep.pageflow.model.attribute.ParagraphAttributes;
import com.gs.ep.pageflow.model.fragment.ParagraphFragment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 流式段落策略
 *
 * 适用于普通正文段落，行从光标处向下流动，放不下时切分到下一栏或下一页。
 * 处理顺序：
 * - 第一阶段：扫描所有行找出浮动对象造成的最窄可用宽度，必要时整段重新测量一次
 * - 第二阶段：上下文间距、保持行在一起、段前间距、切分行并生成片段
 * - 最后：应用段后间距并记录样式
 */
public class FlowingParagraphStrategy extends AbstractParagraphLayoutStrategy {
    private static final Logger LOGGER = LoggerFactory.getLogger(FlowingParagraphStrategy.class);

    @Override
    public ParagraphType getParagraphType() {
        return ParagraphType.FLOWING;
    }

    @Override
    protected void placeParagraph(ParagraphLayoutContext ctx, ParagraphLines lines, ResolvedSpacing spacing) {
        ParagraphAttributes attrs = ctx.block.attrs;
        PageCursor cursor = ctx.cursor;
        String styleId = styleIdOf(ctx.block);

        double spacingBefore = spacing.before;
        boolean appliedSpacingBefore = spacingBefore == 0;

        // 第一阶段：浮动对象扫描
        if (ctx.canRemeasure()) {
            scanFloatsAndRemeasure(ctx, lines, spacingBefore, appliedSpacingBefore);
        }

        // 第二阶段：切分并放置
        Indent indent = attrs.indent;
        double negativeLeftIndent = Math.min(indent.finiteLeft(), 0);
        double negativeRightIndent = Math.min(indent.finiteRight(), 0);

        int fromLine = 0;
        boolean keepLinesChecked = false;
        PageState state = null;
        PageState lastState = null;

        while (fromLine < lines.size()) {
            if (state == null) {
                state = cursor.ensurePage();
            }

            // 上下文间距：与上一段样式相同时取消段前间距并撤回上一段的段后间距
            if (attrs.contextualSpacing && styleId != null && !styleId.isEmpty()
                    && styleId.equals(state.lastParagraphStyleId)) {
                spacingBefore = 0;
                double prevTrailing = LayoutNumbers.safeNonNegative(state.trailingSpacing);
                if (prevTrailing > 0) {
                    state.cursorY -= prevTrailing;
                    state.trailingSpacing = 0;
                }
                LOGGER.trace("Paragraph {} follows style {}, spacing collapsed", ctx.block.id, styleId);
            }

            // 保持行在一起：只在段首检查一次
            if (attrs.keepLines && fromLine == 0 && !keepLinesChecked) {
                keepLinesChecked = true;
                if (shouldMoveToFreshArea(state, lines, spacingBefore, spacing.baseBefore)) {
                    LOGGER.debug("Paragraph {} keeps its lines together, advancing from page {} column {}",
                            ctx.block.id, state.page.number, state.columnIndex);
                    state = cursor.advanceColumn(state);
                    spacingBefore = spacing.baseBefore;
                    appliedSpacingBefore = spacingBefore == 0;
                    continue;
                }
            }

            // 段前间距，与上一段的段后间距折叠
            if (!appliedSpacingBefore && spacingBefore > 0) {
                while (!appliedSpacingBefore) {
                    double prevTrailing = LayoutNumbers.safeNonNegative(state.trailingSpacing);
                    double neededSpacingBefore = Math.max(spacingBefore - prevTrailing, 0);
                    if (state.cursorY + neededSpacingBefore > state.contentBottom) {
                        if (state.cursorY <= state.topMargin) {
                            LOGGER.debug("Paragraph {} spacing before {} exceeds the content area {}, skipped",
                                    ctx.block.id, neededSpacingBefore, state.contentHeight());
                            state.trailingSpacing = 0;
                            appliedSpacingBefore = true;
                            break;
                        }
                        state = cursor.advanceColumn(state);
                        continue;
                    }
                    state.cursorY += neededSpacingBefore;
                    state.trailingSpacing = 0;
                    appliedSpacingBefore = true;
                }
            } else {
                state.trailingSpacing = 0;
            }

            if (state.cursorY >= state.contentBottom) {
                state = cursor.advanceColumn(state);
            }
            if (state.contentBottom - state.cursorY <= 0) {
                state = cursor.advanceColumn(state);
            }
            double nextLineHeight = lines.get(fromLine).safeLineHeight();
            if (state.page.hasContent() && state.remainingHeight() < nextLineHeight) {
                state = cursor.advanceColumn(state);
            }

            double effectiveColumnWidth = ctx.columnWidth;
            double offsetX = 0;
            if (lines.isRemeasuredForFloats()) {
                effectiveColumnWidth = lines.getNarrowestWidth();
                offsetX = lines.getNarrowestOffsetX();
            }

            LineSlice slice = LayoutUtils.sliceLines(lines.getLines(), fromLine, state.contentBottom - state.cursorY);
            double columnX = cursor.columnX(state.columnIndex);

            PmRange pmRange = LayoutUtils.computeFragmentPmRange(ctx.block, lines.getLines(), fromLine, slice.toLine);
            ParagraphFragment.Builder fragment = ParagraphFragment.builder(ctx.block.id)
                    .lines(fromLine, slice.toLine)
                    .position(columnX + offsetX + negativeLeftIndent, state.cursorY)
                    .width(effectiveColumnWidth - negativeLeftIndent - negativeRightIndent)
                    .continuesFromPrev(fromLine > 0)
                    .continuesOnNext(slice.toLine < lines.size())
                    .pmRange(pmRange.pmStart, pmRange.pmEnd);

            if (lines.isRemeasuredForColumnWidth()) {
                fragment.remeasuredLines(lines.getLines().subList(fromLine, slice.toLine));
            }
            if (fromLine == 0) {
                applyMarker(fragment, ctx.measure, lines, true);
            }

            FloatAlignment floatAlignment = attrs.floatAlignment;
            if (floatAlignment == FloatAlignment.RIGHT || floatAlignment == FloatAlignment.CENTER) {
                double sliceWidth = LayoutUtils.maxLineWidth(lines.getLines(), fromLine, slice.toLine);
                double slack = effectiveColumnWidth - sliceWidth;
                fragment.x(columnX + offsetX + (floatAlignment == FloatAlignment.RIGHT ? slack : slack / 2));
            }

            state.page.fragments.add(fragment.build());
            state.cursorY += slice.height;
            lastState = state;
            LOGGER.trace("Paragraph {} lines [{}, {}) placed on page {} column {}",
                    ctx.block.id, fromLine, slice.toLine, state.page.number, state.columnIndex);
            fromLine = slice.toLine;
        }

        if (lastState != null) {
            applySpacingAfter(ctx, lastState, spacing.after);
            lastState.lastParagraphStyleId = styleId;
        }
    }

    /**
     * 扫描所有行在当前光标位置受到的浮动对象限制，取最窄宽度；比无浮动时的内容宽度更窄时整段重新测量一次。
     * 段前间距只作用于临时的 Y 坐标，不修改光标状态。
     */
    private void scanFloatsAndRemeasure(ParagraphLayoutContext ctx, ParagraphLines lines,
                                        double spacingBefore, boolean appliedSpacingBefore) {
        PageState scanState = ctx.cursor.ensurePage();
        double tempY = scanState.cursorY;
        if (!appliedSpacingBefore && spacingBefore > 0) {
            double prevTrailing = LayoutNumbers.safeNonNegative(scanState.trailingSpacing);
            tempY += Math.max(spacingBefore - prevTrailing, 0);
        }

        double narrowestWidth = ctx.columnWidth;
        double narrowestOffsetX = 0;
        for (int i = 0; i < lines.size(); i++) {
            double lineHeight = lines.get(i).safeLineHeight();
            AvailableWidth available = ctx.floatManager.computeAvailableWidth(
                    tempY, lineHeight, ctx.columnWidth, scanState.columnIndex, scanState.page.number);
            if (available.width < narrowestWidth) {
                narrowestWidth = available.width;
                narrowestOffsetX = available.offsetX;
            }
            tempY += lineHeight;
        }

        Indent indent = ctx.block.attrs.indent;
        double narrowestRemeasureWidth = Math.max(1, narrowestWidth - indent.finiteLeft() - indent.finiteRight());
        if (narrowestRemeasureWidth < remeasureWidth(ctx)) {
            double firstLineIndent = MarkerIndents.calculateFirstLineIndent(ctx.block, ctx.measure);
            ParagraphMeasure remeasured = ctx.remeasurer.remeasure(ctx.block, narrowestRemeasureWidth, firstLineIndent);
            lines.replaceForFloats(remeasured, narrowestWidth, narrowestOffsetX);
            LOGGER.debug("Paragraph {} narrowed by floats to {} at offset {}, remeasured to {} lines",
                    ctx.block.id, narrowestWidth, narrowestOffsetX, lines.size());
        }
    }

    /**
     * 段落放不下当前剩余空间、但能放进一个空白页（按未折叠的段前间距计算）且当前页已有内容时，移到下一栏。
     */
    private boolean shouldMoveToFreshArea(PageState state, ParagraphLines lines,
                                          double spacingBefore, double baseSpacingBefore) {
        double prevTrailing = LayoutNumbers.safeNonNegative(state.trailingSpacing);
        double neededSpacingBefore = Math.max(spacingBefore - prevTrailing, 0);
        double fullHeight = LayoutUtils.totalHeight(lines.getLines());
        boolean fitsOnBlankPage = fullHeight + baseSpacingBefore <= state.contentHeight();
        double remainingAfterSpacing = state.contentBottom - (state.cursorY + neededSpacingBefore);
        return fitsOnBlankPage && state.page.hasContent() && fullHeight > remainingAfterSpacing;
    }

    /**
     * 段后间距放得下时推进光标并作为下一段折叠用的 trailing；放不下时移到下一栏，trailing 为 0。
     */
    private void applySpacingAfter(ParagraphLayoutContext ctx, PageState lastState, double spacingAfter) {
        if (spacingAfter <= 0) {
            lastState.trailingSpacing = 0;
            return;
        }
        if (lastState.cursorY + spacingAfter > lastState.contentBottom) {
            LOGGER.debug("Paragraph {} spacing after {} does not fit on page {}, advancing",
                    ctx.block.id, spacingAfter, lastState.page.number);
            PageState next = ctx.cursor.advanceColumn(lastState);
            next.trailingSpacing = 0;
            return;
        }
        lastState.cursorY += spacingAfter;
        lastState.trailingSpacing = spacingAfter;
    }
}
