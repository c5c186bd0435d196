package com.gs.ep.pageflow.layout;

import com.gs.ep.pageflow.model.AnchoredBlock;
import com.gs.ep.pageflow.model.Line;
import com.gs.ep.pageflow.model.ParagraphBlock;
import com.gs.ep.pageflow.model.ParagraphMeasure;
import com.gs.ep.pageflow.model.Run;

import java.util.Collections;
import java.util.List;

/**
 * Line-level helpers shared by the paragraph layout strategies.
 */
public final class LayoutUtils {

    private LayoutUtils() {
    }

    /**
     * Lines of a measure, or a single zero-width line of {@code totalHeight} when the measure has
     * none, so every paragraph takes at least one line slot.
     */
    public static List<Line> normalizeLines(ParagraphMeasure measure) {
        if (!measure.lines.isEmpty()) {
            return measure.lines;
        }
        double height = LayoutNumbers.safeNonNegative(measure.totalHeight);
        return Collections.singletonList(new Line(0, 0, 0, 0, 0, 0, 0, height, null));
    }

    /**
     * Greedily takes lines from {@code startIndex} while their summed height fits
     * {@code availableHeight}. The first line is always taken, so a slice is never empty.
     */
    public static LineSlice sliceLines(List<Line> lines, int startIndex, double availableHeight) {
        double height = 0;
        int index = startIndex;

        while (index < lines.size()) {
            double lineHeight = lines.get(index).safeLineHeight();
            if (height > 0 && height + lineHeight > availableHeight) {
                break;
            }
            height += lineHeight;
            index++;
        }

        if (index == startIndex) {
            height = lines.get(startIndex).safeLineHeight();
            index++;
        }
        return new LineSlice(index, height);
    }

    public static double totalHeight(List<Line> lines) {
        double sum = 0;
        for (Line line : lines) {
            sum += line.safeLineHeight();
        }
        return sum;
    }

    public static double maxLineWidth(List<Line> lines, int fromLine, int toLine) {
        double max = 0;
        for (int i = fromLine; i < toLine; i++) {
            double width = lines.get(i).width;
            if (Double.isFinite(width) && width > max) {
                max = width;
            }
        }
        return max;
    }

    /**
     * Empty paragraphs only keep spacing authored on the paragraph itself; inherited spacing is
     * suppressed.
     */
    public static boolean shouldSuppressSpacingForEmpty(ParagraphBlock block, boolean before) {
        if (!block.isEmptyText()) {
            return false;
        }
        return before ? !block.attrs.spacingExplicit.before : !block.attrs.spacingExplicit.after;
    }

    /**
     * Position range of lines {@code [fromLine, toLine)}, resolved through the runs' positions.
     * Falls back to the block's own range when the runs carry none.
     */
    public static PmRange computeFragmentPmRange(ParagraphBlock block, List<Line> lines, int fromLine, int toLine) {
        if (fromLine >= toLine || lines.isEmpty()) {
            return PmRange.EMPTY;
        }
        Line first = lines.get(fromLine);
        Line last = lines.get(toLine - 1);
        Integer start = positionAt(block.runs, first.fromRun, first.fromChar);
        Integer end = positionAt(block.runs, last.toRun, last.toChar);
        if (start == null && end == null) {
            return extractBlockPmRange(block.attrs.pmStart, block.attrs.pmEnd);
        }
        return new PmRange(start, end);
    }

    public static PmRange extractBlockPmRange(AnchoredBlock block) {
        if (block == null) {
            return PmRange.EMPTY;
        }
        return extractBlockPmRange(block.pmStart, block.pmEnd);
    }

    private static PmRange extractBlockPmRange(Integer pmStart, Integer pmEnd) {
        if (pmStart == null) {
            return new PmRange(null, pmEnd);
        }
        return new PmRange(pmStart, pmEnd != null ? pmEnd : pmStart + 1);
    }

    private static Integer positionAt(List<Run> runs, int runIndex, int charOffset) {
        if (runs.isEmpty() || runIndex < 0) {
            return null;
        }
        if (runIndex >= runs.size()) {
            return runs.get(runs.size() - 1).getPmEnd();
        }
        Run run = runs.get(runIndex);
        if (run.getPmStart() == null) {
            return null;
        }
        int position = run.getPmStart() + Math.max(0, charOffset);
        if (run.getPmEnd() != null) {
            position = Math.min(position, run.getPmEnd());
        }
        return position;
    }
}
