package com.gs.ep.pageflow.model;

/**
 * A run of text in a single font.
 */
public class TextRun implements Run {
    public final String text;
    public final String fontFamily;
    public final double fontSize;
    private final Integer pmStart;
    private final Integer pmEnd;

    public TextRun(String text, String fontFamily, double fontSize, Integer pmStart, Integer pmEnd) {
        this.text = text == null ? "" : text;
        this.fontFamily = fontFamily;
        this.fontSize = fontSize;
        this.pmStart = pmStart;
        this.pmEnd = pmEnd;
    }

    public TextRun(String text, String fontFamily, double fontSize) {
        this(text, fontFamily, fontSize, null, null);
    }

    @Override
    public RunKind getKind() {
        return RunKind.TEXT;
    }

    @Override
    public Integer getPmStart() {
        return pmStart;
    }

    @Override
    public Integer getPmEnd() {
        return pmEnd;
    }

    @Override
    public int length() {
        return text.length();
    }
}
