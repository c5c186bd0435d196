package com.gs.ep.pageflow.app;

public class LayoutCancelledException extends Exception {

    public LayoutCancelledException(String message) {
        super(message);
    }
}
