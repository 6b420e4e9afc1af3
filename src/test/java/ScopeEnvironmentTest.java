import org.junit.jupiter.api.Test;

import com.algoscript.script.parser.Environment;
import com.algoscript.script.parser.EvalError;
import com.algoscript.script.parser.ExpressionParser;
import com.algoscript.script.parser.Scope;
import com.algoscript.script.parser.StatementParser;
import com.algoscript.script.parser.Value;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ScopeEnvironmentTest {

    @Test
    void lookupWalksOutward_assignStaysLocal() {
        Scope global = new Scope();
        Scope call = global.childScope();

        global.assign("g", Value.integer(1));
        call.assign("x", Value.integer(2));
        call.assign("g", Value.integer(3));

        assertEquals(Value.integer(3), call.get("g"));
        assertEquals(Value.integer(1), global.get("g"));
        assertEquals(Value.integer(2), call.get("x"));
        assertThrows(EvalError.class, () -> global.get("x"));

        Scope sibling = global.childScope();
        assertEquals(Value.integer(1), sibling.get("g"));
        assertThrows(EvalError.class, () -> sibling.get("x"));
    }

    @Test
    void undefinedVariable_failsAtTheRoot() {
        Scope call = new Scope().childScope();
        EvalError e = assertThrows(EvalError.class, () -> call.get("nope"));
        assertEquals("Undefined variable: nope", e.getMessage());
    }

    @Test
    void environment_hostApi() {
        Environment env = new Environment();
        env.define("Twice", List.of("x"), StatementParser.parseBody(List.of("return x * 2")));
        env.setGlobal("k", Value.integer(21));

        assertTrue(env.hasAlgorithm("Twice"));
        assertTrue(env.hasBuiltin("cons"));
        assertFalse(env.hasBuiltin("Twice"));
        assertEquals(Environment.DEFAULT_MAX_CALL_DEPTH, env.maxCallDepth());

        assertEquals(Value.integer(42), env.call("Twice", List.of(env.getGlobal("k"))));
        assertEquals(Value.integer(43), env.evaluate(ExpressionParser.parse("Twice(k) + 1", 0)));
        assertEquals(Value.integer(21), env.lookupVariable(env.globalScope(), "k"));
    }

    @Test
    void environment_rejectsNonPositiveDepth() {
        assertThrows(IllegalArgumentException.class, () -> new Environment(0));
    }

    @Test
    void callDepth_isPerEnvironment() {
        Environment env = new Environment(3);
        env.define("Down", List.of("n"), StatementParser.parseBody(List.of(
                "if n == 0 then",
                "    return 0",
                "endif",
                "return Down(n - 1)")));
        assertEquals(Value.integer(0), env.call("Down", List.of(Value.integer(2))));
        assertThrows(com.algoscript.script.parser.RecursionLimitError.class,
                () -> env.call("Down", List.of(Value.integer(3))));
    }
}
