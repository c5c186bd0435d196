package com.gs.ep.pageflow.model;

/**
 * Inline content of a paragraph. Positions are absolute editor positions and may be absent.
 */
public interface Run {

    RunKind getKind();

    /** Position of the first character, inclusive. */
    Integer getPmStart();

    /** Position after the last character, exclusive. */
    Integer getPmEnd();

    /** Number of characters the run contributes to line character offsets. */
    int length();
}
