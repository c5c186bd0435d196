package com.gs.ep.pageflow.layout;

/**
 * 段落布局类型枚举
 * 用于标识段落的放置方式，以便选择合适的布局策略
 */
public enum ParagraphType {

    /**
     * 流式段落：按行切分，可跨栏跨页，受浮动对象影响
     */
    FLOWING("流式段落"),

    /**
     * 定位框段落：frame 的 wrap 为 none，整段作为一个片段放置，不推进光标
     */
    POSITIONED_FRAME("定位框段落");

    private final String displayName;

    ParagraphType(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
