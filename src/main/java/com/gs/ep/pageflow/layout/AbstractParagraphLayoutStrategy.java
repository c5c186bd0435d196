package com.gs.ep.pageflow.layout;

import com.gs.ep.pageflow.layout.anchor.AnchoredObjectPlacer;
import com.gs.ep.pageflow.model.MarkerMeasure;
import com.gs.ep.pageflow.model.ParagraphBlock;
import com.gs.ep.pageflow.model.ParagraphMeasure;
import com.gs.ep.pageflow.model.attribute.Indent;
import com.gs.ep.pageflow.model.fragment.ParagraphFragment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 段落布局策略的抽象基类
 *
 * 提供所有策略通用的步骤：放置锚定对象、按栏宽重新测量、解析间距。
 * 遵循模板方法模式，定义算法骨架，将段落的实际放置延迟到子类实现。
 */
public abstract class AbstractParagraphLayoutStrategy implements ParagraphLayoutStrategy {
    private static final Logger LOGGER = LoggerFactory.getLogger(AbstractParagraphLayoutStrategy.class);

    private final AnchoredObjectPlacer anchoredObjectPlacer = new AnchoredObjectPlacer();

    // ==================== 模板方法 ====================

    @Override
    public void layout(ParagraphLayoutContext ctx, ParagraphAnchorsContext anchors) {
        // 1. 先放置锚定对象，使其排除区域对本段落的行生效
        anchoredObjectPlacer.placeAll(ctx, anchors);

        // 2. 规范化行，必要时按当前栏宽重新测量
        ParagraphLines lines = prepareLines(ctx);

        // 3. 解析段前段后间距
        ResolvedSpacing spacing = ResolvedSpacing.resolve(ctx.block, ctx.overrideSpacingAfter);
        LOGGER.trace("Paragraph {} spacing {}", ctx.block.id, spacing);

        // 4. 放置段落（子类实现）
        placeParagraph(ctx, lines, spacing);
    }

    /**
     * 把段落的行写入页面
     */
    protected abstract void placeParagraph(ParagraphLayoutContext ctx, ParagraphLines lines, ResolvedSpacing spacing);

    // ==================== 公共工具方法 ====================

    /**
     * 段落按更宽的栏测量过（例如单栏节的文本进入多栏节）时，按当前栏宽重新测量一次。
     * 传给重新测量器的是完整栏宽，缩进由测量器自己扣除。
     */
    protected ParagraphLines prepareLines(ParagraphLayoutContext ctx) {
        ParagraphLines lines = new ParagraphLines(LayoutUtils.normalizeLines(ctx.measure));
        Double measurementWidth = lines.get(0).maxWidth;
        double remeasureWidth = remeasureWidth(ctx);

        if (ctx.canRemeasure() && measurementWidth != null && measurementWidth > remeasureWidth) {
            double firstLineIndent = MarkerIndents.calculateFirstLineIndent(ctx.block, ctx.measure);
            ParagraphMeasure remeasured = ctx.remeasurer.remeasure(ctx.block, ctx.columnWidth, firstLineIndent);
            lines.replaceForColumnWidth(remeasured);
            LOGGER.debug("Paragraph {} measured at {} exceeds column content width {}, remeasured to {} lines",
                    ctx.block.id, measurementWidth, remeasureWidth, lines.size());
        }
        return lines;
    }

    /**
     * 栏宽减去段落缩进（负缩进会加宽），至少为 1
     */
    protected double remeasureWidth(ParagraphLayoutContext ctx) {
        Indent indent = ctx.block.attrs.indent;
        return Math.max(1, ctx.columnWidth - indent.finiteLeft() - indent.finiteRight());
    }

    /**
     * 写入列表标记信息。重新测量得到的标记信息优先于原始测量。
     */
    protected void applyMarker(ParagraphFragment.Builder fragment, ParagraphMeasure measure, ParagraphLines lines,
                               boolean includeGutter) {
        MarkerMeasure original = measure.marker;
        MarkerMeasure remeasured = lines.getRemeasuredMarker();
        if (original == null && remeasured == null) {
            return;
        }
        MarkerMeasure effective = remeasured != null ? remeasured : original;

        Double markerWidth = effective.markerWidth;
        if (markerWidth == null && original != null) {
            markerWidth = original.markerWidth;
        }
        Double markerTextWidth = remeasured != null && remeasured.markerTextWidth != null
                ? remeasured.markerTextWidth
                : original != null ? original.markerTextWidth : null;
        Double gutterWidth = null;
        if (includeGutter) {
            gutterWidth = remeasured != null && remeasured.gutterWidth != null
                    ? remeasured.gutterWidth
                    : original != null ? original.gutterWidth : null;
        }
        fragment.marker(markerWidth != null ? markerWidth : 0.0, markerTextWidth, gutterWidth);
    }

    protected static String styleIdOf(ParagraphBlock block) {
        return block.attrs.styleId;
    }
}
