package com.algoscript.script.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.algoscript.debug.Debug;
import com.algoscript.script.parser.Expr.ExprInterface;

/**
 * Environment
 *
 * Everything one run needs, owned in one place:
 *  - definitions: algorithm name -> AlgorithmDefinition (later definitions replace earlier ones)
 *  - global:      the top-level scope; directives that assign write here and it survives
 *                 across directives until the environment is dropped
 *  - builtins:    the fixed native function table
 *
 * A fresh Environment is created per run; nothing is shared between environments.
 */
public class Environment {

    public static final int DEFAULT_MAX_CALL_DEPTH = 1000;

    private static final String TAG = "algoscript.load";

    private final Map<String, AlgorithmDefinition> definitions = new LinkedHashMap<>();
    private final Map<String, BuiltinFunction> builtins;
    private final Scope global = new Scope();
    private final Interpreter interpreter;

    public Environment() {
        this(DEFAULT_MAX_CALL_DEPTH);
    }

    public Environment(int maxCallDepth) {
        if (maxCallDepth < 1) throw new IllegalArgumentException("maxCallDepth must be >= 1, got " + maxCallDepth);
        this.builtins = Builtins.core();
        this.interpreter = new Interpreter(this, maxCallDepth);
    }

    // -------------------------
    // Definitions
    // -------------------------

    public void define(AlgorithmDefinition def) {
        AlgorithmDefinition previous = definitions.put(def.name, def);
        if (previous != null) {
            Debug.get().w(TAG, "Algorithm " + def.name + " (line " + def.line
                    + ") replaces the definition at line " + previous.line);
        }
    }

    public void define(String name, List<String> params, List<Statement.Stmt> body) {
        define(new AlgorithmDefinition(name, params, body, 0));
    }

    public AlgorithmDefinition definition(String name) {
        return definitions.get(name);
    }

    public boolean hasAlgorithm(String name) {
        return definitions.containsKey(name);
    }

    public Map<String, AlgorithmDefinition> definitions() {
        return Collections.unmodifiableMap(definitions);
    }

    BuiltinFunction builtin(String name) {
        return builtins.get(name);
    }

    public boolean hasBuiltin(String name) {
        return builtins.containsKey(name);
    }

    // -------------------------
    // Scopes
    // -------------------------

    public Scope globalScope() {
        return global;
    }

    public Value lookupVariable(Scope scope, String name) {
        return scope.get(name);
    }

    public void setGlobal(String name, Value value) {
        global.assign(name, value);
    }

    public Value getGlobal(String name) {
        return global.get(name);
    }

    // -------------------------
    // Execution
    // -------------------------

    /** Invokes an algorithm (or a built-in) by name, as a top-level call. */
    public Value call(String name, List<Value> args) {
        return interpreter.callForHost(name, args);
    }

    /** Evaluates an expression against the global scope. */
    public Value evaluate(ExprInterface expr) {
        return interpreter.evaluateForHost(expr);
    }

    public int maxCallDepth() {
        return interpreter.maxDepth();
    }
}
