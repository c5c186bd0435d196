package com.gs.ep.pageflow.model.attribute;

/**
 * Paragraph spacing in pixels. {@code lineSpaceBefore}/{@code lineSpaceAfter} are the legacy keys,
 * read only when the primary value is absent.
 */
public class Spacing {
    public static final Spacing NONE = new Spacing(null, null, null, null);

    public final Double before;
    public final Double after;
    public final Double lineSpaceBefore;
    public final Double lineSpaceAfter;

    public Spacing(Double before, Double after, Double lineSpaceBefore, Double lineSpaceAfter) {
        this.before = before;
        this.after = after;
        this.lineSpaceBefore = lineSpaceBefore;
        this.lineSpaceAfter = lineSpaceAfter;
    }

    public static Spacing of(Double before, Double after) {
        return new Spacing(before, after, null, null);
    }

    public Double rawBefore() {
        return before != null ? before : lineSpaceBefore;
    }

    public Double rawAfter() {
        return after != null ? after : lineSpaceAfter;
    }
}
