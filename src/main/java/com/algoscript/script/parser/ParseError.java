package com.algoscript.script.parser;

public class ParseError extends AlgoScriptException {
    private static final long serialVersionUID = 1L;

    public ParseError(String message, int line) {
        super(Kind.PARSE, message, line);
    }
}
