package com.gs.ep.pageflow.model.attribute;

import java.util.Locale;

public enum HorizontalRelativeFrom {
    COLUMN,
    PAGE,
    MARGIN;

    public static HorizontalRelativeFrom fromValue(String value) {
        if (value == null) {
            return null;
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "column":
                return COLUMN;
            case "page":
                return PAGE;
            case "margin":
                return MARGIN;
            default:
                return null;
        }
    }
}
