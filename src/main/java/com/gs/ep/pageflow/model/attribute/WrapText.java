package com.gs.ep.pageflow.model.attribute;

/**
 * Side(s) of an anchored object on which text may flow.
 */
public enum WrapText {
    BOTH_SIDES,
    LEFT,
    RIGHT,
    LARGEST
}
