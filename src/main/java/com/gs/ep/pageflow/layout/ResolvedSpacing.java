package com.gs.ep.pageflow.layout;

import com.gs.ep.pageflow.model.ParagraphBlock;
import com.gs.ep.pageflow.model.attribute.Spacing;

/**
 * Spacing before/after a paragraph after sanitization, empty-paragraph suppression and the
 * driver's spacing-after override. {@code baseBefore} is the uncollapsed value used when checking
 * whether a paragraph fits on a blank page.
 */
public class ResolvedSpacing {
    public final double before;
    public final double after;
    public final double baseBefore;

    ResolvedSpacing(double before, double after) {
        this.before = before;
        this.after = after;
        this.baseBefore = before;
    }

    public static ResolvedSpacing resolve(ParagraphBlock block, Double overrideSpacingAfter) {
        Spacing spacing = block.attrs.spacing;
        double before = LayoutNumbers.safeNonNegative(spacing.rawBefore());
        double after = LayoutNumbers.safeNonNegative(spacing.rawAfter());

        if (LayoutUtils.shouldSuppressSpacingForEmpty(block, true)) {
            before = 0;
        }
        if (LayoutUtils.shouldSuppressSpacingForEmpty(block, false)) {
            after = 0;
        }
        if (overrideSpacingAfter != null) {
            after = LayoutNumbers.safeNonNegative(overrideSpacingAfter);
        }
        return new ResolvedSpacing(before, after);
    }

    @Override
    public String toString() {
        return "ResolvedSpacing{before=" + before + ", after=" + after + "}";
    }
}
