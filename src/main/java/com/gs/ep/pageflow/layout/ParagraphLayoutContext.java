package com.gs.ep.pageflow.layout;

import com.gs.ep.pageflow.model.ParagraphBlock;
import com.gs.ep.pageflow.model.ParagraphMeasure;

import java.util.Objects;

/**
 * Everything one paragraph layout call needs: the block, its measure at full column width, the
 * page cursor, and optional collaborators.
 */
public class ParagraphLayoutContext {
    public final ParagraphBlock block;
    public final ParagraphMeasure measure;
    public final double columnWidth;
    public final PageCursor cursor;
    public final FloatingObjectManager floatManager;
    public final ParagraphRemeasurer remeasurer;
    /** Replaces the resolved spacing-after when set; used by the driver for contextual suppression. */
    public final Double overrideSpacingAfter;

    private ParagraphLayoutContext(Builder builder) {
        this.block = Objects.requireNonNull(builder.block, "block");
        this.measure = Objects.requireNonNull(builder.measure, "measure");
        this.columnWidth = builder.columnWidth;
        this.cursor = Objects.requireNonNull(builder.cursor, "cursor");
        this.floatManager = Objects.requireNonNull(builder.floatManager, "floatManager");
        this.remeasurer = builder.remeasurer == null ? ParagraphRemeasurer.NONE : builder.remeasurer;
        this.overrideSpacingAfter = builder.overrideSpacingAfter;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean canRemeasure() {
        return remeasurer.isAvailable();
    }

    public static class Builder {
        private ParagraphBlock block;
        private ParagraphMeasure measure;
        private double columnWidth;
        private PageCursor cursor;
        private FloatingObjectManager floatManager;
        private ParagraphRemeasurer remeasurer;
        private Double overrideSpacingAfter;

        public Builder block(ParagraphBlock block) {
            this.block = block;
            return this;
        }

        public Builder measure(ParagraphMeasure measure) {
            this.measure = measure;
            return this;
        }

        public Builder columnWidth(double columnWidth) {
            this.columnWidth = columnWidth;
            return this;
        }

        public Builder cursor(PageCursor cursor) {
            this.cursor = cursor;
            return this;
        }

        public Builder floatManager(FloatingObjectManager floatManager) {
            this.floatManager = floatManager;
            return this;
        }

        public Builder remeasurer(ParagraphRemeasurer remeasurer) {
            this.remeasurer = remeasurer;
            return this;
        }

        public Builder overrideSpacingAfter(Double overrideSpacingAfter) {
            this.overrideSpacingAfter = overrideSpacingAfter;
            return this;
        }

        public ParagraphLayoutContext build() {
            return new ParagraphLayoutContext(this);
        }
    }
}
