package com.gs.ep.pageflow.model.attribute;

/**
 * Layout-relevant paragraph attributes, validated once when the block is built.
 * Absent groups are replaced by their NONE constants so layout code never sees null groups.
 */
public class ParagraphAttributes {
    public static final ParagraphAttributes EMPTY = builder().build();

    public final Spacing spacing;
    public final SpacingExplicit spacingExplicit;
    public final String styleId;
    public final boolean contextualSpacing;
    public final boolean keepLines;
    public final Indent indent;
    public final FloatAlignment floatAlignment;
    public final FrameAttributes frame;
    public final WordLayout wordLayout;
    public final Integer pmStart;
    public final Integer pmEnd;

    private ParagraphAttributes(Builder builder) {
        this.spacing = builder.spacing == null ? Spacing.NONE : builder.spacing;
        this.spacingExplicit = builder.spacingExplicit == null ? SpacingExplicit.NONE : builder.spacingExplicit;
        this.styleId = builder.styleId;
        this.contextualSpacing = builder.contextualSpacing;
        this.keepLines = builder.keepLines;
        this.indent = builder.indent == null ? Indent.NONE : builder.indent;
        this.floatAlignment = builder.floatAlignment;
        this.frame = builder.frame;
        this.wordLayout = builder.wordLayout;
        this.pmStart = builder.pmStart;
        this.pmEnd = builder.pmEnd;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isPositionedFrame() {
        return frame != null && frame.isPositioned();
    }

    public static class Builder {
        private Spacing spacing;
        private SpacingExplicit spacingExplicit;
        private String styleId;
        private boolean contextualSpacing;
        private boolean keepLines;
        private Indent indent;
        private FloatAlignment floatAlignment;
        private FrameAttributes frame;
        private WordLayout wordLayout;
        private Integer pmStart;
        private Integer pmEnd;

        public Builder spacing(Spacing spacing) {
            this.spacing = spacing;
            return this;
        }

        public Builder spacing(double before, double after) {
            this.spacing = Spacing.of(before, after);
            return this;
        }

        public Builder spacingExplicit(boolean before, boolean after) {
            this.spacingExplicit = new SpacingExplicit(before, after, false);
            return this;
        }

        public Builder styleId(String styleId) {
            this.styleId = styleId;
            return this;
        }

        /**
         * Accepts any OOXML boolean representation ({@code true}, 1, "1", "true", "on").
         */
        public Builder contextualSpacing(Object contextualSpacing) {
            this.contextualSpacing = OoxmlBoolean.coerce(contextualSpacing);
            return this;
        }

        public Builder keepLines(boolean keepLines) {
            this.keepLines = keepLines;
            return this;
        }

        public Builder indent(Double left, Double right) {
            this.indent = new Indent(left, right);
            return this;
        }

        public Builder floatAlignment(FloatAlignment floatAlignment) {
            this.floatAlignment = floatAlignment;
            return this;
        }

        public Builder frame(FrameAttributes frame) {
            this.frame = frame;
            return this;
        }

        public Builder wordLayout(WordLayout wordLayout) {
            this.wordLayout = wordLayout;
            return this;
        }

        public Builder pmRange(Integer pmStart, Integer pmEnd) {
            this.pmStart = pmStart;
            this.pmEnd = pmEnd;
            return this;
        }

        public ParagraphAttributes build() {
            return new ParagraphAttributes(this);
        }
    }
}
