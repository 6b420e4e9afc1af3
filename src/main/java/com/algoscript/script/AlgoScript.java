package com.algoscript.script;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.algoscript.debug.Debug;
import com.algoscript.script.parser.AlgoScriptException;
import com.algoscript.script.parser.AlgorithmDefinition;
import com.algoscript.script.parser.Environment;
import com.algoscript.script.parser.Expr.ExprInterface;
import com.algoscript.script.parser.ExpressionParser;
import com.algoscript.script.parser.ProgramParser;
import com.algoscript.script.parser.Value;
import com.algoscript.script.render.TreeRenderer;

/**
 * Core AlgoScript engine.
 *
 * - Pseudocode programs made of {@code Algorithm: Name(params)} blocks
 * - Control flow: if / elseif / else / endif, while / endwhile, for-from-to and for-in / endfor, return
 * - Types: number (integer or float), bool, string, None, List (Nil / cons) and Tree (leaf / node)
 * - Directives run one at a time against a loaded program:
 *     - {@code Name(arg, ...)}    call an algorithm or built-in
 *     - {@code Name: arg, ...}    the same call, short form
 *     - {@code ident = expr}      assign a global that later directives can read
 *     - any other expression, evaluated in the global scope
 */
public class AlgoScript {

    /** Receives every directive failure before it is turned into an ERROR value. */
    public interface ErrorReporter {
        void report(String directive, AlgoScriptException error);
    }

    private static final String TAG = "algoscript.exec";

    private static final Pattern ASSIGN = Pattern.compile("^\\s*([A-Za-z_]\\w*)\\s*(?:=(?!=)|←)\\s*(.+)$", Pattern.DOTALL);
    private static final Pattern SHORT_CALL = Pattern.compile("^\\s*([A-Za-z_]\\w*)\\s*:(.*)$", Pattern.DOTALL);

    private static final ErrorReporter LOG_ERRORS = (directive, e) ->
            Debug.get().w(TAG, "Directive '" + directive + "' failed: " + e.getMessage());

    private int maxCallDepth = Environment.DEFAULT_MAX_CALL_DEPTH;
    private ErrorReporter errorReporter = LOG_ERRORS;

    public AlgoScript() {}

    public void setMaxCallDepth(int depth) {
        if (depth < 1) throw new IllegalArgumentException("max call depth must be >= 1, got " + depth);
        this.maxCallDepth = depth;
    }

    public int getMaxCallDepth() { return maxCallDepth; }

    public void setErrorReporter(ErrorReporter reporter) {
        this.errorReporter = (reporter == null) ? LOG_ERRORS : reporter;
    }

    /** An environment with no algorithms, for directive-only runs. */
    public Environment newEnvironment() {
        return new Environment(maxCallDepth);
    }

    /**
     * Parses every {@code Algorithm:} block of {@code source} into a fresh environment.
     *
     * @throws com.algoscript.script.parser.ParseError on unmatched blocks or malformed headers
     * @throws com.algoscript.script.parser.LexError on characters outside the language
     */
    public Environment loadProgram(String source) {
        if (source == null) throw new IllegalArgumentException("source must not be null");
        Environment env = newEnvironment();
        List<AlgorithmDefinition> defs = ProgramParser.parse(source);
        for (AlgorithmDefinition def : defs) env.define(def);
        Debug.get().i("algoscript.load", "Loaded " + env.definitions().size() + " algorithm(s): "
                + String.join(", ", env.definitions().keySet()));
        return env;
    }

    /**
     * Runs one directive and returns its value; a global assignment returns the assigned value.
     * Failures are thrown.
     */
    public Value evaluate(Environment env, String directive) {
        return run(env, directive).value();
    }

    /**
     * Runs one directive, turning any engine failure into an ERROR result so the caller can
     * carry on with the next directive. Globals assigned before a failure stay assigned.
     */
    public DirectiveResult evaluateDirective(Environment env, String directive) {
        try {
            return run(env, directive);
        } catch (AlgoScriptException e) {
            errorReporter.report(directive, e);
            return DirectiveResult.failure(directive, e);
        }
    }

    /** Calls {@code name} with already-built argument values (the JSON case form). */
    public Value invoke(Environment env, String name, List<Value> args) {
        Debug.get().d(TAG, "invoke " + name + args);
        return env.call(name, args == null ? List.of() : args);
    }

    /** {@link #invoke} with failures turned into an ERROR result. */
    public DirectiveResult invokeDirective(Environment env, String name, List<Value> args) {
        String text = name + args;
        try {
            return DirectiveResult.value(text, invoke(env, name, args));
        } catch (AlgoScriptException e) {
            errorReporter.report(text, e);
            return DirectiveResult.failure(text, e);
        }
    }

    public static List<String> renderTree(Value tree) {
        return TreeRenderer.render(tree);
    }

    private DirectiveResult run(Environment env, String directive) {
        if (directive == null || directive.trim().isEmpty()) {
            throw new IllegalArgumentException("directive must not be empty");
        }
        Debug.get().d(TAG, "directive " + directive.trim());

        Matcher m = ASSIGN.matcher(directive);
        if (m.matches()) {
            String name = m.group(1);
            Value value = env.evaluate(ExpressionParser.parse(m.group(2).trim(), 0));
            env.setGlobal(name, value);
            return DirectiveResult.assignment(directive, name, value);
        }

        m = SHORT_CALL.matcher(directive);
        if (m.matches()) {
            String name = m.group(1);
            List<Value> args = new ArrayList<>();
            for (ExprInterface arg : ExpressionParser.parseList(m.group(2), 0)) {
                args.add(env.evaluate(arg));
            }
            return DirectiveResult.value(directive, env.call(name, args));
        }

        return DirectiveResult.value(directive, env.evaluate(ExpressionParser.parse(directive.trim(), 0)));
    }
}
