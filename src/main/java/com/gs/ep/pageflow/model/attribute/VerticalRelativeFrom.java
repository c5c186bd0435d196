package com.gs.ep.pageflow.model.attribute;

import java.util.Locale;

public enum VerticalRelativeFrom {
    PARAGRAPH,
    PAGE,
    MARGIN;

    public static VerticalRelativeFrom fromValue(String value) {
        if (value == null) {
            return null;
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "paragraph":
                return PARAGRAPH;
            case "page":
                return PAGE;
            case "margin":
                return MARGIN;
            default:
                return null;
        }
    }
}
