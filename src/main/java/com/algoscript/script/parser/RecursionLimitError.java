package com.algoscript.script.parser;

public class RecursionLimitError extends AlgoScriptException {
    private static final long serialVersionUID = 1L;

    public RecursionLimitError(String message) {
        super(Kind.RECURSION_LIMIT, message, 0);
    }

    public RecursionLimitError(String message, Throwable cause) {
        super(Kind.RECURSION_LIMIT, message, 0, cause);
    }
}
