package com.algoscript.protocol;

import java.util.ArrayList;
import java.util.List;

import com.algoscript.debug.Debug;
import com.algoscript.protocol.util.ValueJson;
import com.algoscript.script.AlgoScript;
import com.algoscript.script.DirectiveResult;
import com.algoscript.script.parser.AlgoScriptException;
import com.algoscript.script.parser.Environment;
import com.algoscript.script.parser.EvalError;
import com.algoscript.script.parser.ExpressionParser;
import com.algoscript.script.parser.ParseError;
import com.algoscript.script.parser.Value;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Runs cases in order against one environment. A failing case yields an error result and the
 * run moves on to the next case.
 */
public final class CaseRunner {

    private static final String TAG = "algoscript.cases";

    private final AlgoScript engine;
    private final Environment env;

    public CaseRunner(AlgoScript engine, Environment env) {
        this.engine = engine;
        this.env = env;
    }

    public List<DirectiveResult> runAll(List<Case> cases) {
        List<DirectiveResult> results = new ArrayList<>(cases.size());
        for (Case c : cases) results.add(run(c));
        return results;
    }

    public DirectiveResult run(Case c) {
        if (c.isMalformed()) return DirectiveResult.failure(c.directive(), new ParseError(c.problem(), 0));
        if (!c.isInvocation()) return engine.evaluateDirective(env, c.directive());

        List<Value> args = new ArrayList<>(c.args().size());
        try {
            for (JsonNode a : c.args()) args.add(ValueJson.fromJson(a, this::argumentText));
        } catch (IllegalArgumentException e) {
            EvalError err = new EvalError("Bad argument for " + c.algorithm() + ": " + e.getMessage());
            Debug.get().w(TAG, err.getMessage());
            return DirectiveResult.failure(c.toString(), err);
        }

        DirectiveResult r = engine.invokeDirective(env, c.algorithm(), args);
        if (c.store() != null && !r.isError()) env.setGlobal(c.store(), r.value());
        return r;
    }

    /** A JSON string argument is an expression when it evaluates, otherwise the string itself. */
    private Value argumentText(String text) {
        try {
            return env.evaluate(ExpressionParser.parse(text, 0));
        } catch (AlgoScriptException e) {
            Debug.get().d(TAG, "Argument '" + text + "' kept as a string: " + e.getMessage());
            return Value.string(text);
        }
    }
}
