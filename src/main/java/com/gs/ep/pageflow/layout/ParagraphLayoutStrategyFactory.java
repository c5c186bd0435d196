package com.gs.ep.pageflow.layout;

import com.gs.ep.pageflow.layout.strategy.FlowingParagraphStrategy;
import com.gs.ep.pageflow.layout.strategy.PositionedFrameStrategy;
import com.gs.ep.pageflow.model.ParagraphBlock;

/**
 * 段落布局策略工厂
 *
 * 负责：
 * 1. 检测段落的布局类型
 * 2. 根据类型返回合适的处理策略
 *
 * 策略类是无状态的，缓存为单例复用。
 */
public class ParagraphLayoutStrategyFactory {

    private static final FlowingParagraphStrategy FLOWING_STRATEGY = new FlowingParagraphStrategy();
    private static final PositionedFrameStrategy POSITIONED_FRAME_STRATEGY = new PositionedFrameStrategy();

    /**
     * 根据段落属性自动检测类型并返回策略
     */
    public ParagraphLayoutStrategy createStrategy(ParagraphBlock block) {
        return getStrategy(detectParagraphType(block));
    }

    /**
     * 根据段落类型获取对应的策略实例
     */
    public ParagraphLayoutStrategy getStrategy(ParagraphType paragraphType) {
        switch (paragraphType) {
            case POSITIONED_FRAME:
                return POSITIONED_FRAME_STRATEGY;
            case FLOWING:
            default:
                return FLOWING_STRATEGY;
        }
    }

    /**
     * 检测段落类型：frame 的 wrap 为 none 时为定位框段落，其余为流式段落
     */
    public ParagraphType detectParagraphType(ParagraphBlock block) {
        return block.attrs.isPositionedFrame() ? ParagraphType.POSITIONED_FRAME : ParagraphType.FLOWING;
    }
}
