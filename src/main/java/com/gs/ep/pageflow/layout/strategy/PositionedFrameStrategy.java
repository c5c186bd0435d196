package com.gs.ep.pageflow.layout.strategy;

import com.gs.ep.pageflow.layout.AbstractParagraphLayoutStrategy;
import com.gs.ep.pageflow.layout.LayoutUtils;
import com.gs.ep.pageflow.layout.PageState;
import com.gs.ep.pageflow.layout.ParagraphLayoutContext;
import com.gs.ep.pageflow.layout.ParagraphLines;
import com.gs.ep.pageflow.layout.ParagraphType;
import com.gs.ep.pageflow.layout.PmRange;
import com.gs.ep.pageflow.layout.ResolvedSpacing;
import com.gs.ep.pageflow.model.attribute.FrameAttributes;
import com.gs.ep.pageflow.model.attribute.HorizontalAlign;
import com.gs.ep.pageflow.model.fragment.ParagraphFragment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 定位框段落策略
 *
 * 适用于 frame 的 wrap 为 none 的段落（文本框式的绝对定位段落）。
 * 主要特点：
 * - 整段作为一个片段放置，不切分
 * - 按 xAlign 在栏内对齐，再叠加 frame 的 x/y 偏移
 * - 不推进光标，不应用段前段后间距
 */
public class PositionedFrameStrategy extends AbstractParagraphLayoutStrategy {
    private static final Logger LOGGER = LoggerFactory.getLogger(PositionedFrameStrategy.class);

    @Override
    public ParagraphType getParagraphType() {
        return ParagraphType.POSITIONED_FRAME;
    }

    @Override
    protected void placeParagraph(ParagraphLayoutContext ctx, ParagraphLines lines, ResolvedSpacing spacing) {
        FrameAttributes frame = ctx.block.attrs.frame;
        PageState state = ctx.cursor.ensurePage();
        if (state.cursorY >= state.contentBottom) {
            state = ctx.cursor.advanceColumn(state);
        }

        double maxLineWidth = LayoutUtils.maxLineWidth(lines.getLines(), 0, lines.size());
        double fragmentWidth = maxLineWidth > 0 ? maxLineWidth : ctx.columnWidth;

        double x = ctx.cursor.columnX(state.columnIndex);
        if (frame.xAlign == HorizontalAlign.RIGHT) {
            x += ctx.columnWidth - fragmentWidth;
        } else if (frame.xAlign == HorizontalAlign.CENTER) {
            x += (ctx.columnWidth - fragmentWidth) / 2;
        }
        x += frame.finiteX();
        double y = state.cursorY + frame.finiteY();

        PmRange pmRange = LayoutUtils.computeFragmentPmRange(ctx.block, lines.getLines(), 0, lines.size());
        ParagraphFragment.Builder fragment = ParagraphFragment.builder(ctx.block.id)
                .lines(0, lines.size())
                .position(x, y)
                .width(fragmentWidth)
                .pmRange(pmRange.pmStart, pmRange.pmEnd);
        applyMarker(fragment, ctx.measure, lines, false);

        state.page.fragments.add(fragment.build());
        state.trailingSpacing = 0;
        state.lastParagraphStyleId = styleIdOf(ctx.block);
        LOGGER.debug("Placed frame paragraph {} at ({}, {}) width {} on page {}",
                ctx.block.id, x, y, fragmentWidth, state.page.number);
    }
}
