package com.gs.ep.pageflow.model.attribute;

import java.util.Locale;

public enum FloatAlignment {
    LEFT,
    CENTER,
    RIGHT;

    public static FloatAlignment fromValue(String value) {
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
