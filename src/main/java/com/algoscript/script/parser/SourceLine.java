package com.algoscript.script.parser;

/** One physical line of program text and its 1-based position in the source. */
public final class SourceLine {
    public final int number;
    public final String text;

    public SourceLine(int number, String text) {
        this.number = number;
        this.text = text;
    }

    @Override
    public String toString() {
        return number + ": " + text;
    }
}
