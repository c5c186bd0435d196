package com.gs.ep.pageflow.model;

/**
 * A tab character. Its width is resolved by the measurer from the paragraph's tab stops.
 */
public class TabRun implements Run {
    public final Double width;
    private final Integer pmStart;
    private final Integer pmEnd;

    public TabRun(Double width, Integer pmStart, Integer pmEnd) {
        this.width = width;
        this.pmStart = pmStart;
        this.pmEnd = pmEnd;
    }

    @Override
    public RunKind getKind() {
        return RunKind.TAB;
    }

    @Override
    public Integer getPmStart() {
        return pmStart;
    }

    @Override
    public Integer getPmEnd() {
        return pmEnd;
    }

    @Override
    public int length() {
        return 1;
    }
}
