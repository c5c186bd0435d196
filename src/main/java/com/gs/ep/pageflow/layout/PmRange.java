package com.gs.ep.pageflow.layout;

/**
 * Editor position range covered by a fragment. Either end may be unknown.
 */
public class PmRange {
    public static final PmRange EMPTY = new PmRange(null, null);

    public final Integer pmStart;
    public final Integer pmEnd;

    public PmRange(Integer pmStart, Integer pmEnd) {
        this.pmStart = pmStart;
        this.pmEnd = pmEnd;
    }
}
