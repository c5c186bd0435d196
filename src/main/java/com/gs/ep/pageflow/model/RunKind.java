package com.gs.ep.pageflow.model;

public enum RunKind {
    TEXT,
    TAB,
    LINE_BREAK
}
