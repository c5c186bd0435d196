package com.gs.ep.pageflow.model;

public class LineBreakRun implements Run {
    private final Integer pmStart;
    private final Integer pmEnd;

    public LineBreakRun(Integer pmStart, Integer pmEnd) {
        this.pmStart = pmStart;
        this.pmEnd = pmEnd;
    }

    @Override
    public RunKind getKind() {
        return RunKind.LINE_BREAK;
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
        return 0;
    }
}
