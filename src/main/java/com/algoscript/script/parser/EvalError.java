package com.algoscript.script.parser;

public class EvalError extends AlgoScriptException {
    private static final long serialVersionUID = 1L;

    public EvalError(String message) {
        super(Kind.EVAL, message, 0);
    }

    public EvalError(String message, int line) {
        super(Kind.EVAL, message, line);
    }

    public EvalError(String message, int line, Throwable cause) {
        super(Kind.EVAL, message, line, cause);
    }
}
