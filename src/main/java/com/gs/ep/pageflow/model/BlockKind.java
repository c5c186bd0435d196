package com.gs.ep.pageflow.model;

public enum BlockKind {
    PARAGRAPH,
    IMAGE,
    DRAWING
}
