package com.algoscript.script;

import com.algoscript.script.parser.AlgoScriptException;
import com.algoscript.script.parser.Value;

/**
 * Outcome of one directive: a value, a completed global assignment, or a failure carried as
 * an ERROR value together with the exception that caused it.
 */
public class DirectiveResult {
    private final String directive;
    private final Value value;
    private final String assignedName;
    private final AlgoScriptException error;

    private DirectiveResult(String directive, Value value, String assignedName, AlgoScriptException error) {
        this.directive = directive;
        this.value = value;
        this.assignedName = assignedName;
        this.error = error;
    }

    static DirectiveResult value(String directive, Value value) {
        return new DirectiveResult(directive, value, null, null);
    }

    static DirectiveResult assignment(String directive, String name, Value value) {
        return new DirectiveResult(directive, value, name, null);
    }

    public static DirectiveResult failure(String directive, AlgoScriptException error) {
        return new DirectiveResult(directive, Value.error(error.kind(), error.getMessage()), null, error);
    }

    public String directive() { return directive; }
    public Value value() { return value; }

    public boolean isError() { return error != null; }
    public AlgoScriptException error() { return error; }

    /** Name of the global written by an assignment directive, null for any other directive. */
    public String assignedName() { return assignedName; }
    public boolean isAssignment() { return assignedName != null; }

    @Override
    public String toString() {
        if (isAssignment()) return assignedName + " = " + value;
        return String.valueOf(value);
    }
}
