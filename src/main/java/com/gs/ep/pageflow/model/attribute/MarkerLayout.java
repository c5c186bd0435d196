package com.gs.ep.pageflow.model.attribute;

/**
 * Marker box resolved by the list layout, in pixels.
 */
public class MarkerLayout {
    public final Double markerBoxWidthPx;

    public MarkerLayout(Double markerBoxWidthPx) {
        this.markerBoxWidthPx = markerBoxWidthPx;
    }
}
