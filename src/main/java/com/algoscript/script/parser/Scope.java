package com.algoscript.script.parser;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One frame of variable bindings with a link to its enclosing frame.
 *
 * The global scope has no parent. A call scope is created per algorithm invocation with the
 * global scope as parent, so a call sees its own locals first and top-level variables second,
 * and never the locals of its caller.
 */
public class Scope {

    private final Scope parent;
    private final Map<String, Value> vars = new LinkedHashMap<>();

    /** The global scope. */
    public Scope() {
        this.parent = null;
    }

    private Scope(Scope parent) {
        this.parent = parent;
    }

    public Scope childScope() {
        return new Scope(this);
    }

    // -------------------------
    // Vars API
    // -------------------------

    /** Binds {@code name} in this scope, overwriting any earlier binding here. Enclosing scopes are never touched. */
    public void assign(String name, Value value) {
        vars.put(name, value);
    }

    public Value get(String name) {
        for (Scope s = this; s != null; s = s.parent) {
            Value v = s.vars.get(name);
            if (v != null) return v;
        }
        throw new EvalError("Undefined variable: " + name);
    }
}
