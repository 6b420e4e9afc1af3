package com.algoscript.script.parser;

/**
 * Base of every error the engine raises. Carries the error kind and, where known,
 * the 1-based source line the failure belongs to (0 when unknown).
 */
public class AlgoScriptException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public enum Kind { LEX, PARSE, EVAL, RECURSION_LIMIT }

    private final Kind kind;
    private final int line;

    protected AlgoScriptException(Kind kind, String message, int line) {
        super(message);
        this.kind = kind;
        this.line = line;
    }

    protected AlgoScriptException(Kind kind, String message, int line, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.line = line;
    }

    public Kind kind() { return kind; }

    public int line() { return line; }

    /** Message without any line decoration. */
    public String detail() { return super.getMessage(); }

    @Override
    public String getMessage() {
        if (line <= 0) return super.getMessage();
        return "[line " + line + "] " + super.getMessage();
    }
}
