package com.gs.ep.pageflow.app;

public class LayoutConfigException extends RuntimeException {

    public LayoutConfigException(String message) {
        super(message);
    }

    public LayoutConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
