package com.gs.ep.pageflow.model.attribute;

import java.util.Locale;

public enum HorizontalAlign {
    LEFT,
    CENTER,
    RIGHT;

    /**
     * @return the matching constant, or null for unknown or absent values
     */
    public static HorizontalAlign fromValue(String value) {
        if (value == null) {
            return null;
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "left":
                return LEFT;
            case "center":
                return CENTER;
            case "right":
                return RIGHT;
            default:
                return null;
        }
    }
}
