import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.algoscript.script.AlgoScript;
import com.algoscript.script.parser.Environment;
import com.algoscript.script.parser.EvalError;
import com.algoscript.script.parser.ParseError;
import com.algoscript.script.parser.Value;

import static org.junit.jupiter.api.Assertions.*;

public class ExpressionEvaluationTest {

    private AlgoScript es;
    private Environment env;

    @BeforeEach
    void setUp() {
        es = new AlgoScript();
        env = es.newEnvironment();
    }

    private Value eval(String expr) {
        return es.evaluate(env, expr);
    }

    @Test
    void arithmetic_precedence() {
        assertEquals(14L, eval("2 + 3 * 4").asLong());
        assertEquals(20L, eval("(2 + 3) * 4").asLong());
        assertEquals(-6L, eval("-2 * 3").asLong());
        assertEquals(4L, eval("10 - 3 - 3").asLong());
        assertEquals(1L, eval("7 % 3 * 1").asLong());
        assertEquals(5L, eval("--5").asLong());
    }

    @Test
    void division_staysIntegerOnlyWhenExact() {
        Value exact = eval("10 / 2");
        assertTrue(exact.isInteger());
        assertEquals(5L, exact.asLong());

        Value inexact = eval("7 / 2");
        assertFalse(inexact.isInteger());
        assertEquals(3.5, inexact.asNumber(), 1e-9);

        assertEquals(0.75, eval("1.5 / 2").asNumber(), 1e-9);
    }

    @Test
    void divisionAndModuloByZero_fail() {
        EvalError e = assertThrows(EvalError.class, () -> eval("1 / 0"));
        assertTrue(e.getMessage().contains("Division by zero"));
        assertThrows(EvalError.class, () -> eval("1.0 / 0.0"));
        assertThrows(EvalError.class, () -> eval("5 % 0"));
    }

    @Test
    void modulo_takesSignOfDivisor() {
        assertEquals(1L, eval("7 mod 3").asLong());
        assertEquals(2L, eval("-7 % 3").asLong());
        assertEquals(-2L, eval("7 % -3").asLong());
        assertEquals(1.5, eval("5.5 % 2").asNumber(), 1e-9);
    }

    @Test
    void integerOverflow_isEvalError() {
        assertThrows(EvalError.class, () -> eval("9223372036854775807 + 1"));
        assertThrows(EvalError.class, () -> eval("3037000500 * 3037000500"));
    }

    @Test
    void comparisons_andChaining() {
        assertTrue(eval("1 < 2").asBool());
        assertTrue(eval("1 < 2 < 3").asBool());
        assertFalse(eval("3 > 2 > 1 > 1").asBool());
        assertTrue(eval("1 <= 1 == 1").asBool());
        assertTrue(eval("2 == 2.0").asBool());
        assertTrue(eval("'abc' < 'abd'").asBool());
        assertTrue(eval("[1, 2] == cons(1, cons(2, Nil))").asBool());
        assertTrue(eval("leaf != node(leaf, 1, leaf)").asBool());
    }

    @Test
    void orderingMixedTypes_fails() {
        EvalError e = assertThrows(EvalError.class, () -> eval("1 < 'a'"));
        assertTrue(e.getMessage().contains("Cannot compare"));
    }

    @Test
    void logicalOperators_precedenceAndAliases() {
        assertTrue(eval("true or false and false").asBool());
        assertFalse(eval("(true or false) and false").asBool());
        assertTrue(eval("not 1 > 2").asBool());
        assertTrue(eval("NOT false AND true").asBool());
        assertTrue(eval("1 == 1 && 2 == 2 || false").asBool());
        assertFalse(eval("!True").asBool());
    }

    @Test
    void logicalOperators_shortCircuit() {
        assertTrue(eval("true or doesNotExist(1)").asBool());
        assertFalse(eval("false and doesNotExist(1)").asBool());
        assertThrows(EvalError.class, () -> eval("false or doesNotExist(1)"));
    }

    @Test
    void conditionalExpression_isLazy() {
        assertEquals(1L, eval("1 if 2 > 1 else doesNotExist()").asLong());
        assertEquals(2L, eval("doesNotExist() if 0 else 2").asLong());
        assertEquals("c", eval("'a' if false else 'b' if false else 'c'").asString());
    }

    @Test
    void truthiness() {
        assertEquals(2L, eval("1 if '' else 2").asLong());
        assertEquals(2L, eval("1 if None else 2").asLong());
        assertEquals(2L, eval("1 if 0.0 else 2").asLong());
        assertEquals(1L, eval("1 if Nil else 2").asLong());
        assertEquals(1L, eval("1 if leaf else 2").asLong());
    }

    @Test
    void stringConcatenation_onlyBetweenStrings() {
        assertEquals("ab", eval("'a' + \"b\"").asString());
        assertThrows(EvalError.class, () -> eval("'a' + 1"));
    }

    @Test
    void undefinedVariable_andUnknownFunction() {
        EvalError e1 = assertThrows(EvalError.class, () -> eval("missing + 1"));
        assertTrue(e1.getMessage().contains("Undefined variable: missing"));
        EvalError e2 = assertThrows(EvalError.class, () -> eval("frobnicate(1)"));
        assertTrue(e2.getMessage().contains("Unknown function: frobnicate"));
    }

    @Test
    void malformedExpressions_areParseErrors() {
        assertThrows(ParseError.class, () -> eval("1 +"));
        assertThrows(ParseError.class, () -> eval("(1 + 2"));
        assertThrows(ParseError.class, () -> eval("f(1,"));
        assertThrows(ParseError.class, () -> eval("1 2"));
        assertThrows(ParseError.class, () -> eval("1 if true"));
    }
}
