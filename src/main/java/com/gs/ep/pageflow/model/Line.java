package com.gs.ep.pageflow.model;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A measured line box within a paragraph, as produced by the measurer.
 * Immutable once produced; a remeasure yields new instances rather than mutating these.
 */
public class Line {
    public final int fromRun;
    public final int fromChar;
    public final int toRun;
    public final int toChar;
    public final double width;
    public final double ascent;
    public final double descent;
    public final double lineHeight;
    /** Width the line was broken against, or null when the measurer did not record it. */
    public final Double maxWidth;
    /** Explicit per-run x offsets (tab stops). Never re-offset by indent logic. */
    public final List<LineSegment> segments;

    public Line(int fromRun, int fromChar, int toRun, int toChar,
                double width, double ascent, double descent, double lineHeight,
                Double maxWidth, List<LineSegment> segments) {
        this.fromRun = fromRun;
        this.fromChar = fromChar;
        this.toRun = toRun;
        this.toChar = toChar;
        this.width = width;
        this.ascent = ascent;
        this.descent = descent;
        this.lineHeight = lineHeight;
        this.maxWidth = maxWidth;
        this.segments = segments == null ? Collections.emptyList() : Collections.unmodifiableList(segments);
    }

    public Line(int fromRun, int fromChar, int toRun, int toChar,
                double width, double ascent, double descent, double lineHeight, Double maxWidth) {
        this(fromRun, fromChar, toRun, toChar, width, ascent, descent, lineHeight, maxWidth, null);
    }

    /**
     * Line height with NaN and negatives read as zero.
     */
    public double safeLineHeight() {
        return Double.isFinite(lineHeight) && lineHeight > 0 ? lineHeight : 0;
    }

    public boolean hasSegments() {
        return !segments.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Line)) {
            return false;
        }
        Line that = (Line) o;
        return fromRun == that.fromRun
                && fromChar == that.fromChar
                && toRun == that.toRun
                && toChar == that.toChar
                && Double.compare(width, that.width) == 0
                && Double.compare(ascent, that.ascent) == 0
                && Double.compare(descent, that.descent) == 0
                && Double.compare(lineHeight, that.lineHeight) == 0
                && Objects.equals(maxWidth, that.maxWidth);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fromRun, fromChar, toRun, toChar, width, lineHeight, maxWidth);
    }

    @Override
    public String toString() {
        return "Line[" + fromRun + ":" + fromChar + "-" + toRun + ":" + toChar
                + ", width=" + width + ", lineHeight=" + lineHeight + ", maxWidth=" + maxWidth + "]";
    }
}
