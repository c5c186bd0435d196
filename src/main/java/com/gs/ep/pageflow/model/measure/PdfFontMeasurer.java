package com.gs.ep.pageflow.model.measure;

import com.gs.ep.pageflow.layout.ParagraphRemeasurer;
import com.gs.ep.pageflow.model.Line;
import com.gs.ep.pageflow.model.MarkerMeasure;
import com.gs.ep.pageflow.model.ParagraphBlock;
import com.gs.ep.pageflow.model.ParagraphMeasure;
import com.gs.ep.pageflow.model.Run;
import com.gs.ep.pageflow.model.RunKind;
import com.gs.ep.pageflow.model.TabRun;
import com.gs.ep.pageflow.model.TextRun;
import com.gs.ep.pageflow.model.attribute.Indent;
import com.gs.ep.pageflow.model.attribute.WordLayout;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDFontDescriptor;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Measures paragraphs against the metrics of the PDF standard 14 fonts.
 *
 * <p>Lines are broken greedily, preferring the last space that fits and falling back to a
 * character break for words wider than the line. The paragraph's indents are subtracted from
 * {@code maxWidth}; the first line additionally loses {@code firstLineIndent}.
 */
public class PdfFontMeasurer implements ParagraphRemeasurer {
    private static final Logger LOGGER = LoggerFactory.getLogger(PdfFontMeasurer.class);

    public static final double DEFAULT_FONT_SIZE = 12;
    public static final double DEFAULT_LINE_HEIGHT_MULTIPLIER = 1.15;
    public static final double DEFAULT_TAB_WIDTH = 48;

    private final double defaultFontSize;
    private final double lineHeightMultiplier;
    private final double defaultTabWidth;

    public PdfFontMeasurer() {
        this(DEFAULT_FONT_SIZE, DEFAULT_LINE_HEIGHT_MULTIPLIER, DEFAULT_TAB_WIDTH);
    }

    public PdfFontMeasurer(double defaultFontSize, double lineHeightMultiplier, double defaultTabWidth) {
        this.defaultFontSize = defaultFontSize;
        this.lineHeightMultiplier = lineHeightMultiplier;
        this.defaultTabWidth = defaultTabWidth;
    }

    public ParagraphMeasure measure(ParagraphBlock block, double maxWidth) {
        return measure(block, maxWidth, 0);
    }

    @Override
    public ParagraphMeasure remeasure(ParagraphBlock block, double maxWidth, double firstLineIndent) {
        return measure(block, maxWidth, firstLineIndent);
    }

    public ParagraphMeasure measure(ParagraphBlock block, double maxWidth, double firstLineIndent) {
        Indent indent = block.attrs.indent;
        double contentWidth = Math.max(1, maxWidth - indent.finiteLeft() - indent.finiteRight());
        double firstLineWidth = Math.max(1, contentWidth - Math.max(0, firstLineIndent));

        List<Unit> units = flatten(block);
        List<Line> lines = new ArrayList<>();
        int start = 0;
        while (start < units.size()) {
            double available = lines.isEmpty() ? firstLineWidth : contentWidth;
            double width = 0;
            int breakAfterSpace = -1;
            int end = units.size();
            int next = units.size();

            for (int i = start; i < units.size(); i++) {
                Unit unit = units.get(i);
                if (unit.forcedBreak) {
                    end = i;
                    next = i + 1;
                    break;
                }
                if (i > start && width + unit.width > available) {
                    if (unit.space) {
                        end = i;
                        next = i + 1;
                    } else if (breakAfterSpace > start) {
                        end = breakAfterSpace;
                        next = breakAfterSpace;
                    } else {
                        end = i;
                        next = i;
                    }
                    break;
                }
                width += unit.width;
                if (unit.space) {
                    breakAfterSpace = i + 1;
                }
            }
            lines.add(buildLine(units, start, end, contentWidth));
            start = next;
        }
        if (lines.isEmpty()) {
            lines.add(emptyLine(block, contentWidth));
        }

        ParagraphMeasure measure = ParagraphMeasure.ofLines(lines, markerOf(block));
        LOGGER.trace("Measured paragraph {} at width {} into {} lines, height {}",
                block.id, maxWidth, lines.size(), measure.totalHeight);
        return measure;
    }

    private List<Unit> flatten(ParagraphBlock block) {
        List<Unit> units = new ArrayList<>();
        for (int runIndex = 0; runIndex < block.runs.size(); runIndex++) {
            Run run = block.runs.get(runIndex);
            if (run.getKind() == RunKind.LINE_BREAK) {
                double[] metrics = verticalMetrics(PDType1Font.HELVETICA, defaultFontSize);
                units.add(new Unit(runIndex, 0, 0, false, true, metrics[0], metrics[1]));
            } else if (run.getKind() == RunKind.TAB) {
                Double tabWidth = ((TabRun) run).width;
                double width = tabWidth != null && Double.isFinite(tabWidth) && tabWidth >= 0 ? tabWidth : defaultTabWidth;
                double[] metrics = verticalMetrics(PDType1Font.HELVETICA, defaultFontSize);
                units.add(new Unit(runIndex, 0, width, false, false, metrics[0], metrics[1]));
            } else {
                TextRun textRun = (TextRun) run;
                PDFont font = resolveFont(textRun.fontFamily);
                double fontSize = fontSizeOf(textRun);
                double[] metrics = verticalMetrics(font, fontSize);
                String text = textRun.text;
                for (int charIndex = 0; charIndex < text.length(); charIndex++) {
                    char c = text.charAt(charIndex);
                    units.add(new Unit(runIndex, charIndex, charWidth(font, fontSize, c), c == ' ', false,
                            metrics[0], metrics[1]));
                }
            }
        }
        return units;
    }

    private Line buildLine(List<Unit> units, int start, int end, double contentWidth) {
        if (end <= start) {
            Unit anchor = units.get(Math.min(start, units.size() - 1));
            double height = (anchor.ascent + anchor.descent) * lineHeightMultiplier;
            return new Line(anchor.runIndex, anchor.charIndex, anchor.runIndex, anchor.charIndex,
                    0, anchor.ascent, anchor.descent, height, contentWidth);
        }
        Unit first = units.get(start);
        Unit last = units.get(end - 1);

        int visibleEnd = end;
        while (visibleEnd > start && units.get(visibleEnd - 1).space) {
            visibleEnd--;
        }
        double width = 0;
        for (int i = start; i < visibleEnd; i++) {
            width += units.get(i).width;
        }
        double ascent = 0;
        double descent = 0;
        for (int i = start; i < end; i++) {
            ascent = Math.max(ascent, units.get(i).ascent);
            descent = Math.max(descent, units.get(i).descent);
        }
        return new Line(first.runIndex, first.charIndex, last.runIndex, last.charIndex + 1,
                width, ascent, descent, (ascent + descent) * lineHeightMultiplier, contentWidth);
    }

    private Line emptyLine(ParagraphBlock block, double contentWidth) {
        PDFont font = PDType1Font.HELVETICA;
        double fontSize = defaultFontSize;
        if (!block.runs.isEmpty() && block.runs.get(0) instanceof TextRun) {
            TextRun run = (TextRun) block.runs.get(0);
            font = resolveFont(run.fontFamily);
            fontSize = fontSizeOf(run);
        }
        double[] metrics = verticalMetrics(font, fontSize);
        return new Line(0, 0, 0, 0, 0, metrics[0], metrics[1],
                (metrics[0] + metrics[1]) * lineHeightMultiplier, contentWidth);
    }

    private MarkerMeasure markerOf(ParagraphBlock block) {
        WordLayout wordLayout = block.attrs.wordLayout;
        if (wordLayout == null || wordLayout.marker == null) {
            return null;
        }
        return new MarkerMeasure(wordLayout.marker.markerBoxWidthPx, null, null, block.attrs.indent.finiteLeft());
    }

    private double fontSizeOf(TextRun run) {
        return Double.isFinite(run.fontSize) && run.fontSize > 0 ? run.fontSize : defaultFontSize;
    }

    static PDFont resolveFont(String fontFamily) {
        if (fontFamily == null) {
            return PDType1Font.HELVETICA;
        }
        String family = fontFamily.toLowerCase(Locale.ROOT);
        if (family.contains("courier") || family.contains("mono")) {
            return PDType1Font.COURIER;
        }
        if (family.contains("times") || (family.contains("serif") && !family.contains("sans"))) {
            return PDType1Font.TIMES_ROMAN;
        }
        return PDType1Font.HELVETICA;
    }

    private static double charWidth(PDFont font, double fontSize, char c) {
        try {
            return font.getStringWidth(String.valueOf(c)) * fontSize / 1000.0;
        } catch (IOException | IllegalArgumentException e) {
            // glyph not encodable in the font
            LOGGER.trace("No width for '{}' in {}, using half an em", c, font.getName());
            return fontSize * 0.5;
        }
    }

    private static double[] verticalMetrics(PDFont font, double fontSize) {
        PDFontDescriptor descriptor = font.getFontDescriptor();
        if (descriptor == null) {
            return new double[]{fontSize * 0.8, fontSize * 0.2};
        }
        double ascent = descriptor.getAscent() * fontSize / 1000.0;
        double descent = Math.abs(descriptor.getDescent() * fontSize / 1000.0);
        return new double[]{ascent, descent};
    }

    private static class Unit {
        final int runIndex;
        final int charIndex;
        final double width;
        final boolean space;
        final boolean forcedBreak;
        final double ascent;
        final double descent;

        Unit(int runIndex, int charIndex, double width, boolean space, boolean forcedBreak,
             double ascent, double descent) {
            this.runIndex = runIndex;
            this.charIndex = charIndex;
            this.width = width;
            this.space = space;
            this.forcedBreak = forcedBreak;
            this.ascent = ascent;
            this.descent = descent;
        }
    }
}
