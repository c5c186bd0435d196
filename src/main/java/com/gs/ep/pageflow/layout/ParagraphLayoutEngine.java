package com.gs.ep.pageflow.layout;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for laying out one paragraph block into the page/column cursor.
 *
 * <p>Anchored objects attached to the paragraph are placed first, then the paragraph is placed
 * either as a positioned frame or as flowing lines. The engine holds no state between calls;
 * everything that carries over from paragraph to paragraph lives in the {@link PageState}.
 */
public class ParagraphLayoutEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(ParagraphLayoutEngine.class);

    private final ParagraphLayoutStrategyFactory strategyFactory;

    public ParagraphLayoutEngine() {
        this(new ParagraphLayoutStrategyFactory());
    }

    public ParagraphLayoutEngine(ParagraphLayoutStrategyFactory strategyFactory) {
        this.strategyFactory = strategyFactory;
    }

    public void layoutParagraphBlock(ParagraphLayoutContext ctx) {
        layoutParagraphBlock(ctx, null);
    }

    public void layoutParagraphBlock(ParagraphLayoutContext ctx, ParagraphAnchorsContext anchors) {
        ParagraphLayoutStrategy strategy = strategyFactory.createStrategy(ctx.block);
        LOGGER.trace("Laying out paragraph {} as {}", ctx.block.id, strategy.getParagraphType());
        strategy.layout(ctx, anchors);
    }
}
