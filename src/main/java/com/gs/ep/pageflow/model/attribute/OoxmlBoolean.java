package com.gs.ep.pageflow.model.attribute;

import java.util.Locale;

/**
 * Coerces OOXML-style boolean representations. {@code true}, {@code 1}, {@code "1"},
 * {@code "true"} and {@code "on"} (any case) are true; everything else, null included, is false.
 */
public final class OoxmlBoolean {

    private OoxmlBoolean() {
    }

    public static boolean coerce(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue() == 1;
        }
        if (value instanceof CharSequence) {
            String normalized = value.toString().trim().toLowerCase(Locale.ROOT);
            return normalized.equals("true") || normalized.equals("1") || normalized.equals("on");
        }
        return false;
    }
}
