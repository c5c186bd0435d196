package com.gs.ep.pageflow.model;

public class ImageMeasure extends ObjectMeasure {

    public ImageMeasure(double width, double height) {
        super(width, height);
    }

    @Override
    public BlockKind getKind() {
        return BlockKind.IMAGE;
    }
}
