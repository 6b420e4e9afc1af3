package com.algoscript.script.parser;

import java.util.List;

import com.algoscript.script.parser.Interpreter.ReturnSignal;
import com.algoscript.script.parser.Statement.Stmt;

/** A named, parameterized algorithm with its parsed body. */
public class AlgorithmDefinition {
    public final String name;
    public final List<String> params;
    public final List<Stmt> body;
    public final int line;

    public AlgorithmDefinition(String name, List<String> params, List<Stmt> body, int line) {
        this.name = name;
        this.params = List.copyOf(params);
        this.body = List.copyOf(body);
        this.line = line;
    }

    public int arity() {
        return params.size();
    }

    Value call(Interpreter interpreter, List<Value> args) {
        if (args.size() != params.size()) {
            throw new EvalError(name + "() expects " + params.size() + " arguments, got " + args.size());
        }

        Scope previous = interpreter.scope;

        // The call frame hangs off the global scope, not off the caller's scope.
        interpreter.scope = interpreter.environment().globalScope().childScope();

        try {
            for (int i = 0; i < params.size(); i++) {
                interpreter.scope.assign(params.get(i), args.get(i));
            }

            try {
                interpreter.executeBlock(body);
            } catch (ReturnSignal rs) {
                return rs.value;
            }

            return Value.none();
        } finally {
            interpreter.scope = previous;
        }
    }

    @Override
    public String toString() {
        return name + "(" + String.join(", ", params) + ")";
    }
}
