package com.gs.ep.pageflow.model.fragment;

public enum FragmentKind {
    PARA,
    IMAGE,
    DRAWING
}
