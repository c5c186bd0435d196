package com.gs.ep.pageflow.layout;

/**
 * 段落布局策略接口
 *
 * 不同的段落类型（流式段落、定位框段落）有不同的放置方式。
 * 策略模式允许根据段落属性在运行时选择合适的处理方式。
 */
public interface ParagraphLayoutStrategy {

    /**
     * 获取该策略适用的段落类型
     */
    ParagraphType getParagraphType();

    /**
     * 布局一个段落：放置锚定对象，然后把段落的行作为片段写入页面
     *
     * @param ctx 段落布局上下文
     * @param anchors 锚定对象上下文，可以为 null
     */
    void layout(ParagraphLayoutContext ctx, ParagraphAnchorsContext anchors);
}
