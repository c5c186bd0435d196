package com.gs.ep.pageflow.model.fragment;

public class ImageFragment extends AnchoredFragment {
    private final ImageFragmentMetadata metadata;

    public ImageFragment(String blockId, double x, double y, double width, double height, int zIndex,
                         ImageFragmentMetadata metadata, Integer pmStart, Integer pmEnd) {
        super(blockId, x, y, width, height, zIndex, pmStart, pmEnd);
        this.metadata = metadata;
    }

    @Override
    public FragmentKind getKind() {
        return FragmentKind.IMAGE;
    }

    public ImageFragmentMetadata getMetadata() {
        return metadata;
    }
}
