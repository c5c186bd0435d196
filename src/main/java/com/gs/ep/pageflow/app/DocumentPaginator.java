package com.gs.ep.pageflow.app;

import com.gs.ep.pageflow.layout.ParagraphAnchorsContext;
import com.gs.ep.pageflow.layout.ParagraphLayoutContext;
import com.gs.ep.pageflow.layout.ParagraphLayoutEngine;
import com.gs.ep.pageflow.layout.ParagraphRemeasurer;
import com.gs.ep.pageflow.layout.floats.DefaultFloatingObjectManager;
import com.gs.ep.pageflow.layout.paginator.PageGeometry;
import com.gs.ep.pageflow.layout.paginator.Paginator;
import com.gs.ep.pageflow.model.ParagraphBlock;
import org.eclipse.collections.api.set.MutableSet;
import org.eclipse.collections.impl.factory.Sets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * Lays out a sequence of paragraphs onto pages.
 *
 * <p>Each call starts from an empty paginator and float manager. Anchored objects are placed at
 * most once per call. Cancellation is checked between paragraphs; a paragraph in progress always
 * completes.
 */
public class DocumentPaginator {
    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentPaginator.class);

    private final PageGeometry geometry;
    private final ParagraphRemeasurer remeasurer;
    private final ParagraphLayoutEngine engine;

    public DocumentPaginator(PageGeometry geometry, ParagraphRemeasurer remeasurer) {
        this(geometry, remeasurer, new ParagraphLayoutEngine());
    }

    public DocumentPaginator(PageGeometry geometry, ParagraphRemeasurer remeasurer, ParagraphLayoutEngine engine) {
        this.geometry = geometry;
        this.remeasurer = remeasurer == null ? ParagraphRemeasurer.NONE : remeasurer;
        this.engine = engine;
    }

    public DocumentLayout layout(List<FlowItem> items) throws LayoutCancelledException {
        return layout(items, () -> false);
    }

    public DocumentLayout layout(List<FlowItem> items, BooleanSupplier cancelled) throws LayoutCancelledException {
        LOGGER.info("Laying out {} paragraphs on {}", items.size(), geometry);
        Paginator paginator = new Paginator(geometry);
        DefaultFloatingObjectManager floatManager =
                new DefaultFloatingObjectManager(geometry.columns, geometry.margins, geometry.pageWidth);
        MutableSet<String> placedAnchoredIds = Sets.mutable.empty();

        for (int index = 0; index < items.size(); index++) {
            FlowItem item = items.get(index);
            if (cancelled.getAsBoolean()) {
                LOGGER.info("Layout cancelled before paragraph {} ({} of {})", item.block.id, index + 1, items.size());
                throw new LayoutCancelledException("Layout cancelled before paragraph " + item.block.id);
            }

            ParagraphLayoutContext ctx = ParagraphLayoutContext.builder()
                    .block(item.block)
                    .measure(item.measure)
                    .columnWidth(geometry.columns.width)
                    .cursor(paginator)
                    .floatManager(floatManager)
                    .remeasurer(remeasurer)
                    .overrideSpacingAfter(spacingAfterOverride(items, index))
                    .build();
            ParagraphAnchorsContext anchors = item.anchoredDrawings.isEmpty()
                    ? null
                    : new ParagraphAnchorsContext(item.anchoredDrawings, geometry.pageWidth, geometry.margins,
                            geometry.columns, placedAnchoredIds);
            engine.layoutParagraphBlock(ctx, anchors);
        }

        LOGGER.info("Layout finished: {} paragraphs on {} pages", items.size(), paginator.getPages().size());
        return new DocumentLayout(paginator.getPages(), geometry);
    }

    /**
     * A paragraph with contextual spacing followed by a paragraph of the same style drops its
     * spacing after.
     */
    static Double spacingAfterOverride(List<FlowItem> items, int index) {
        ParagraphBlock current = items.get(index).block;
        String styleId = current.attrs.styleId;
        if (!current.attrs.contextualSpacing || styleId == null || styleId.isEmpty() || index + 1 >= items.size()) {
            return null;
        }
        return styleId.equals(items.get(index + 1).block.attrs.styleId) ? 0.0 : null;
    }
}
