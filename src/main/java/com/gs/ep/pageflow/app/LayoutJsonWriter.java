package com.gs.ep.pageflow.app;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gs.ep.pageflow.layout.Page;
import com.gs.ep.pageflow.layout.paginator.PageGeometry;
import com.gs.ep.pageflow.model.DrawingGeometry;
import com.gs.ep.pageflow.model.fragment.AnchoredFragment;
import com.gs.ep.pageflow.model.fragment.DrawingFragment;
import com.gs.ep.pageflow.model.fragment.Fragment;
import com.gs.ep.pageflow.model.fragment.ImageFragment;
import com.gs.ep.pageflow.model.fragment.ImageFragmentMetadata;
import com.gs.ep.pageflow.model.fragment.ParagraphFragment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.Locale;

/**
 * Serializes a {@link DocumentLayout} to JSON for renderers and debugging.
 * Absent optional values (marker fields, positions) are omitted rather than written as null.
 */
public class LayoutJsonWriter {
    private static final Logger LOGGER = LoggerFactory.getLogger(LayoutJsonWriter.class);

    private final ObjectMapper objectMapper = new ObjectMapper();

    public ObjectNode toJson(DocumentLayout layout) {
        ObjectNode root = objectMapper.createObjectNode();
        root.set("pageSize", pageSize(layout.getGeometry()));

        ArrayNode pages = root.putArray("pages");
        for (Page page : layout.getPages()) {
            ObjectNode pageNode = pages.addObject();
            pageNode.put("number", page.number);
            ArrayNode fragments = pageNode.putArray("fragments");
            for (Fragment fragment : page.fragments) {
                fragments.add(fragment(fragment));
            }
        }
        return root;
    }

    public String toJsonString(DocumentLayout layout) throws IOException {
        return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(toJson(layout));
    }

    public void write(DocumentLayout layout, File file) throws IOException {
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(file, toJson(layout));
        LOGGER.info("Wrote layout of {} pages to {}", layout.getPageCount(), file.getAbsolutePath());
    }

    private ObjectNode pageSize(PageGeometry geometry) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("w", geometry.pageWidth);
        node.put("h", geometry.pageHeight);
        ObjectNode margins = node.putObject("margins");
        margins.put("top", geometry.margins.top);
        margins.put("right", geometry.margins.right);
        margins.put("bottom", geometry.margins.bottom);
        margins.put("left", geometry.margins.left);
        node.put("columns", geometry.columns.count);
        node.put("columnGap", geometry.columns.gap);
        return node;
    }

    private ObjectNode fragment(Fragment fragment) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("kind", fragment.getKind().name().toLowerCase(Locale.ROOT));
        node.put("blockId", fragment.getBlockId());
        node.put("x", fragment.getX());
        node.put("y", fragment.getY());
        node.put("width", fragment.getWidth());
        putIfPresent(node, "pmStart", fragment.getPmStart());
        putIfPresent(node, "pmEnd", fragment.getPmEnd());

        if (fragment instanceof ParagraphFragment) {
            ParagraphFragment paragraph = (ParagraphFragment) fragment;
            node.put("fromLine", paragraph.getFromLine());
            node.put("toLine", paragraph.getToLine());
            if (paragraph.isContinuesFromPrev()) {
                node.put("continuesFromPrev", true);
            }
            if (paragraph.isContinuesOnNext()) {
                node.put("continuesOnNext", true);
            }
            putIfPresent(node, "markerWidth", paragraph.getMarkerWidth());
            putIfPresent(node, "markerTextWidth", paragraph.getMarkerTextWidth());
            putIfPresent(node, "markerGutter", paragraph.getMarkerGutter());
            if (paragraph.getLines() != null) {
                node.put("remeasuredLines", paragraph.getLines().size());
            }
        } else if (fragment instanceof AnchoredFragment) {
            AnchoredFragment anchored = (AnchoredFragment) fragment;
            node.put("height", anchored.getHeight());
            node.put("isAnchored", anchored.isAnchored());
            node.put("zIndex", anchored.getZIndex());
            if (fragment instanceof ImageFragment) {
                node.set("metadata", metadata(((ImageFragment) fragment).getMetadata()));
            } else if (fragment instanceof DrawingFragment) {
                DrawingFragment drawing = (DrawingFragment) fragment;
                node.put("drawingKind", drawing.getDrawingKind().name());
                node.put("scale", drawing.getScale());
                if (drawing.getDrawingContentId() != null) {
                    node.put("drawingContentId", drawing.getDrawingContentId());
                }
                if (drawing.getGeometry() != null) {
                    node.set("geometry", geometry(drawing.getGeometry()));
                }
            }
        }
        return node;
    }

    private ObjectNode metadata(ImageFragmentMetadata metadata) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("originalWidth", metadata.originalWidth);
        node.put("originalHeight", metadata.originalHeight);
        node.put("maxWidth", metadata.maxWidth);
        node.put("maxHeight", metadata.maxHeight);
        node.put("aspectRatio", metadata.aspectRatio);
        node.put("minWidth", metadata.minWidth);
        node.put("minHeight", metadata.minHeight);
        return node;
    }

    private ObjectNode geometry(DrawingGeometry geometry) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("width", geometry.width);
        node.put("height", geometry.height);
        node.put("rotation", geometry.rotation);
        node.put("flipH", geometry.flipH);
        node.put("flipV", geometry.flipV);
        return node;
    }

    private static void putIfPresent(ObjectNode node, String field, Double value) {
        if (value != null) {
            node.put(field, value);
        }
    }

    private static void putIfPresent(ObjectNode node, String field, Integer value) {
        if (value != null) {
            node.put(field, value);
        }
    }
}
