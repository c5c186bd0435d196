package com.gs.ep.pageflow.app;

import com.gs.ep.pageflow.layout.AnchoredDrawingEntry;
import com.gs.ep.pageflow.layout.Page;
import com.gs.ep.pageflow.layout.paginator.PageGeometry;
import com.gs.ep.pageflow.model.ImageBlock;
import com.gs.ep.pageflow.model.ImageMeasure;
import com.gs.ep.pageflow.model.ParagraphBlock;
import com.gs.ep.pageflow.model.TextRun;
import com.gs.ep.pageflow.model.attribute.FrameAttributes;
import com.gs.ep.pageflow.model.attribute.FrameWrap;
import com.gs.ep.pageflow.model.attribute.HorizontalAlign;
import com.gs.ep.pageflow.model.attribute.HorizontalRelativeFrom;
import com.gs.ep.pageflow.model.attribute.ImageAnchor;
import com.gs.ep.pageflow.model.attribute.ImageWrap;
import com.gs.ep.pageflow.model.attribute.MarkerLayout;
import com.gs.ep.pageflow.model.attribute.ParagraphAttributes;
import com.gs.ep.pageflow.model.attribute.VerticalAlign;
import com.gs.ep.pageflow.model.attribute.VerticalRelativeFrom;
import com.gs.ep.pageflow.model.attribute.WordLayout;
import com.gs.ep.pageflow.model.attribute.WrapText;
import com.gs.ep.pageflow.model.attribute.WrapType;
import com.gs.ep.pageflow.model.fragment.Fragment;
import com.gs.ep.pageflow.model.measure.PdfFontMeasurer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Demo that lays out a generated document with the configured geometry and logs where each
 * fragment landed.
 * Usage: PageFlowDemo [paragraphCount] [outputJson]
 */
public class PageFlowDemo {
    private static final Logger LOGGER = LoggerFactory.getLogger(PageFlowDemo.class);

    private static final String BODY_TEXT = "The quick brown fox jumps over the lazy dog while the paginator "
            + "keeps track of the cursor, collapses adjacent spacing and splits long paragraphs across "
            + "columns and pages. ";

    public static void main(String[] args) throws Exception {
        int paragraphCount = args.length > 0 ? Integer.parseInt(args[0]) : 40;

        LayoutConfig config = new LayoutConfig();
        PageGeometry geometry = config.toPageGeometry();
        PdfFontMeasurer measurer = config.createMeasurer();

        List<FlowItem> items = buildSampleDocument(paragraphCount, measurer, geometry.columns.width);
        DocumentLayout layout = new DocumentPaginator(geometry, measurer).layout(items);

        for (Page page : layout.getPages()) {
            LOGGER.info("Page {}: {} fragments", page.number, page.fragments.size());
            for (Fragment fragment : page.fragments) {
                LOGGER.info("  {} {} at ({}, {}) width {}", fragment.getKind(), fragment.getBlockId(),
                        Math.round(fragment.getX()), Math.round(fragment.getY()), Math.round(fragment.getWidth()));
            }
        }
        LOGGER.info("Laid out {} paragraphs on {} pages", items.size(), layout.getPageCount());

        if (args.length > 1) {
            new LayoutJsonWriter().write(layout, new File(args[1]));
        }
    }

    static List<FlowItem> buildSampleDocument(int paragraphCount, PdfFontMeasurer measurer, double columnWidth) {
        List<FlowItem> items = new ArrayList<>();
        int pm = 0;
        for (int i = 0; i < paragraphCount; i++) {
            String text = BODY_TEXT.repeat(1 + i % 4).trim();
            ParagraphAttributes.Builder attrs = ParagraphAttributes.builder();

            if (i % 10 == 0) {
                attrs.styleId("Heading1").spacing(24, 12).keepLines(true);
                text = "Section " + (i / 10 + 1);
            } else if (i % 10 >= 6 && i % 10 <= 8) {
                attrs.styleId("ListParagraph").contextualSpacing(true).spacing(6, 6).indent(36.0, 0.0)
                        .wordLayout(new WordLayout(new MarkerLayout(18.0), true));
            } else if (i % 10 == 9) {
                attrs.frame(new FrameAttributes(FrameWrap.NONE, 0.0, 0.0, HorizontalAlign.RIGHT));
                text = "Positioned note " + i;
            } else {
                attrs.styleId("Normal").spacing(0, 10);
            }

            attrs.pmRange(pm, pm + text.length());
            ParagraphBlock block = new ParagraphBlock("p" + i,
                    Collections.singletonList(new TextRun(text, "Helvetica", 12, pm, pm + text.length())),
                    attrs.build());
            pm += text.length() + 2;

            List<AnchoredDrawingEntry> anchored = null;
            if (i == 3) {
                ImageBlock image = new ImageBlock("img-" + i, "sample.png",
                        new ImageAnchor(HorizontalRelativeFrom.COLUMN, VerticalRelativeFrom.PARAGRAPH,
                                HorizontalAlign.RIGHT, VerticalAlign.TOP, null, 0.0, false),
                        new ImageWrap(WrapType.SQUARE, WrapText.BOTH_SIDES, 0, 6, 12, 0), pm, pm + 1);
                anchored = Collections.singletonList(new AnchoredDrawingEntry(image, new ImageMeasure(160, 120)));
            }
            items.add(new FlowItem(block, measurer.measure(block, columnWidth), anchored));
        }
        return items;
    }
}
