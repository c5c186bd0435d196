package com.gs.ep.pageflow.model;

public enum DrawingKind {
    VECTOR_SHAPE,
    SHAPE_GROUP,
    IMAGE
}
