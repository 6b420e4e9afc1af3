package com.algoscript.script.parser;

public class LexError extends AlgoScriptException {
    private static final long serialVersionUID = 1L;

    public LexError(String message, int line) {
        super(Kind.LEX, message, line);
    }
}
