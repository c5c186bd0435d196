package com.gs.ep.pageflow.model.fragment;

import com.gs.ep.pageflow.model.Line;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A slice {@code [fromLine, toLine)} of a paragraph's lines placed on a page.
 */
public class ParagraphFragment implements Fragment {
    private final String blockId;
    private final int fromLine;
    private final int toLine;
    private final double x;
    private final double y;
    private final double width;
    private final boolean continuesFromPrev;
    private final boolean continuesOnNext;
    private final Double markerWidth;
    private final Double markerTextWidth;
    private final Double markerGutter;
    private final List<Line> lines;
    private final Integer pmStart;
    private final Integer pmEnd;

    private ParagraphFragment(Builder builder) {
        this.blockId = builder.blockId;
        this.fromLine = builder.fromLine;
        this.toLine = builder.toLine;
        this.x = builder.x;
        this.y = builder.y;
        this.width = builder.width;
        this.continuesFromPrev = builder.continuesFromPrev;
        this.continuesOnNext = builder.continuesOnNext;
        this.markerWidth = builder.markerWidth;
        this.markerTextWidth = builder.markerTextWidth;
        this.markerGutter = builder.markerGutter;
        this.lines = builder.lines == null ? null : Collections.unmodifiableList(builder.lines);
        this.pmStart = builder.pmStart;
        this.pmEnd = builder.pmEnd;
    }

    public static Builder builder(String blockId) {
        return new Builder(blockId);
    }

    @Override
    public FragmentKind getKind() {
        return FragmentKind.PARA;
    }

    @Override
    public String getBlockId() {
        return blockId;
    }

    public int getFromLine() {
        return fromLine;
    }

    public int getToLine() {
        return toLine;
    }

    @Override
    public double getX() {
        return x;
    }

    @Override
    public double getY() {
        return y;
    }

    @Override
    public double getWidth() {
        return width;
    }

    public boolean isContinuesFromPrev() {
        return continuesFromPrev;
    }

    public boolean isContinuesOnNext() {
        return continuesOnNext;
    }

    public Double getMarkerWidth() {
        return markerWidth;
    }

    public Double getMarkerTextWidth() {
        return markerTextWidth;
    }

    public Double getMarkerGutter() {
        return markerGutter;
    }

    /**
     * Re-wrapped lines for this slice when the paragraph was remeasured for a narrower column.
     * Null when the renderer should look the lines up in the original measure.
     */
    public List<Line> getLines() {
        return lines;
    }

    @Override
    public Integer getPmStart() {
        return pmStart;
    }

    @Override
    public Integer getPmEnd() {
        return pmEnd;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ParagraphFragment)) {
            return false;
        }
        ParagraphFragment that = (ParagraphFragment) o;
        return fromLine == that.fromLine
                && toLine == that.toLine
                && Double.compare(x, that.x) == 0
                && Double.compare(y, that.y) == 0
                && Double.compare(width, that.width) == 0
                && continuesFromPrev == that.continuesFromPrev
                && continuesOnNext == that.continuesOnNext
                && Objects.equals(blockId, that.blockId)
                && Objects.equals(markerWidth, that.markerWidth)
                && Objects.equals(markerTextWidth, that.markerTextWidth)
                && Objects.equals(markerGutter, that.markerGutter)
                && Objects.equals(lines, that.lines)
                && Objects.equals(pmStart, that.pmStart)
                && Objects.equals(pmEnd, that.pmEnd);
    }

    @Override
    public int hashCode() {
        return Objects.hash(blockId, fromLine, toLine, x, y, width, continuesFromPrev, continuesOnNext);
    }

    @Override
    public String toString() {
        return "ParagraphFragment[" + blockId + " lines " + fromLine + "-" + toLine
                + " @(" + x + ", " + y + ") width=" + width
                + (continuesFromPrev ? " <cont" : "") + (continuesOnNext ? " cont>" : "") + "]";
    }

    public static class Builder {
        private final String blockId;
        private int fromLine;
        private int toLine;
        private double x;
        private double y;
        private double width;
        private boolean continuesFromPrev;
        private boolean continuesOnNext;
        private Double markerWidth;
        private Double markerTextWidth;
        private Double markerGutter;
        private List<Line> lines;
        private Integer pmStart;
        private Integer pmEnd;

        private Builder(String blockId) {
            this.blockId = blockId;
        }

        public Builder lines(int fromLine, int toLine) {
            this.fromLine = fromLine;
            this.toLine = toLine;
            return this;
        }

        public Builder position(double x, double y) {
            this.x = x;
            this.y = y;
            return this;
        }

        public Builder x(double x) {
            this.x = x;
            return this;
        }

        public Builder width(double width) {
            this.width = width;
            return this;
        }

        public Builder continuesFromPrev(boolean continuesFromPrev) {
            this.continuesFromPrev = continuesFromPrev;
            return this;
        }

        public Builder continuesOnNext(boolean continuesOnNext) {
            this.continuesOnNext = continuesOnNext;
            return this;
        }

        public Builder marker(Double markerWidth, Double markerTextWidth, Double markerGutter) {
            this.markerWidth = markerWidth;
            this.markerTextWidth = markerTextWidth;
            this.markerGutter = markerGutter;
            return this;
        }

        public Builder remeasuredLines(List<Line> lines) {
            this.lines = lines;
            return this;
        }

        public Builder pmRange(Integer pmStart, Integer pmEnd) {
            this.pmStart = pmStart;
            this.pmEnd = pmEnd;
            return this;
        }

        public ParagraphFragment build() {
            return new ParagraphFragment(this);
        }
    }
}
