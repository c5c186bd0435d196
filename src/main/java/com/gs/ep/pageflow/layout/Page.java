package com.gs.ep.pageflow.layout;

import com.gs.ep.pageflow.model.fragment.Fragment;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * A page under construction: its 1-based number and the fragments placed on it so far.
 */
public class Page {
    public final int number;
    public final MutableList<Fragment> fragments;

    public Page(int number) {
        this(number, Lists.mutable.empty());
    }

    private Page(int number, MutableList<Fragment> fragments) {
        this.number = number;
        this.fragments = fragments;
    }

    public boolean hasContent() {
        return fragments.notEmpty();
    }

    /**
     * Copy with its own fragment list. Fragments are immutable and shared.
     */
    public Page copy() {
        return new Page(number, Lists.mutable.withAll(fragments));
    }

    @Override
    public String toString() {
        return "Page[" + number + ", fragments=" + fragments.size() + "]";
    }
}
