package com.gs.ep.pageflow.model.attribute;

import java.util.Locale;

/**
 * Text wrapping of a framed paragraph (w:framePr/@w:wrap).
 */
public enum FrameWrap {
    AUTO,
    NONE,
    AROUND,
    NOT_BESIDE,
    THROUGH,
    TIGHT;

    public static FrameWrap fromValue(String value) {
        if (value == null) {
            return null;
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "none":
                return NONE;
            case "around":
                return AROUND;
            case "notbeside":
                return NOT_BESIDE;
            case "through":
                return THROUGH;
            case "tight":
                return TIGHT;
            case "auto":
                return AUTO;
            default:
                return null;
        }
    }
}
