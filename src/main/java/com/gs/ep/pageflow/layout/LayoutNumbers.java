package com.gs.ep.pageflow.layout;

/**
 * Numeric sanitization for authoring data. Imported documents are not trusted to carry finite,
 * non-negative spacing, widths or marker sizes; such values are read as zero instead of failing.
 */
public final class LayoutNumbers {

    private LayoutNumbers() {
    }

    /**
     * @return {@code value} when finite and non-negative, otherwise 0
     */
    public static double safeNonNegative(double value) {
        return Double.isFinite(value) && value >= 0 ? value : 0;
    }

    public static double safeNonNegative(Double value) {
        return value == null ? 0 : safeNonNegative(value.doubleValue());
    }
}
