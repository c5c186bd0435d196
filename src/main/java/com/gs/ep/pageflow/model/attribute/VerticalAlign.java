package com.gs.ep.pageflow.model.attribute;

import java.util.Locale;

public enum VerticalAlign {
    TOP,
    CENTER,
    BOTTOM;

    public static VerticalAlign fromValue(String value) {
        if (value == null) {
            return null;
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "top":
                return TOP;
            case "center":
                return CENTER;
            case "bottom":
                return BOTTOM;
            default:
                return null;
        }
    }
}
