package com.gs.ep.pageflow.model.attribute;

/**
 * Records which spacing values were authored on the paragraph itself rather than inherited
 * from styles or document defaults.
 */
public class SpacingExplicit {
    public static final SpacingExplicit NONE = new SpacingExplicit(false, false, false);

    public final boolean before;
    public final boolean after;
    public final boolean line;

    public SpacingExplicit(boolean before, boolean after, boolean line) {
        this.before = before;
        this.after = after;
        this.line = line;
    }
}
