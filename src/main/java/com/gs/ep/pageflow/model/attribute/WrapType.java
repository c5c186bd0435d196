package com.gs.ep.pageflow.model.attribute;

public enum WrapType {
    NONE,
    SQUARE,
    TIGHT,
    THROUGH,
    TOP_AND_BOTTOM,
    INLINE;

    /**
     * Whether text beside the object is pushed aside.
     */
    public boolean narrowsText() {
        return this == SQUARE || this == TIGHT || this == THROUGH;
    }
}
