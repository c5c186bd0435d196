package com.gs.ep.pageflow.model.fragment;

/**
 * A positioned, renderable piece of a block on one page. Never mutated after it is emitted.
 */
public interface Fragment {

    FragmentKind getKind();

    String getBlockId();

    double getX();

    double getY();

    double getWidth();

    Integer getPmStart();

    Integer getPmEnd();
}
