import org.junit.jupiter.api.Test;

import com.algoscript.script.AlgoScript;
import com.algoscript.script.parser.AlgoList;
import com.algoscript.script.parser.AlgoTree;
import com.algoscript.script.parser.Environment;
import com.algoscript.script.parser.EvalError;
import com.algoscript.script.parser.Value;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class AlgoListTreeTest {

    private static Value n(long x) { return Value.integer(x); }

    @Test
    void cons_prependsWithoutTouchingTheOriginal() {
        AlgoList tail = AlgoList.of(n(2), n(3));
        AlgoList list = tail.cons(n(1));

        assertEquals(List.of(n(1), n(2), n(3)), list.toJavaList());
        assertEquals(List.of(n(2), n(3)), tail.toJavaList());
        assertSame(tail, list.tail());
        assertEquals(n(1), list.head());
        assertEquals(3, list.size());
    }

    @Test
    void nil_isEmptyAndRejectsAccessors() {
        AlgoList nil = AlgoList.nil();
        assertTrue(nil.isEmpty());
        assertEquals(0, nil.size());
        assertSame(nil, AlgoList.of(List.of()));
        assertThrows(EvalError.class, nil::head);
        assertThrows(EvalError.class, nil::tail);
        assertEquals("Nil", nil.toString());
    }

    @Test
    void merge_keepsFirstListOrderAndSharesSecond() {
        AlgoList a = AlgoList.of(n(1), n(2));
        AlgoList b = AlgoList.of(n(3), n(4));
        AlgoList merged = a.append(b);

        assertEquals(List.of(n(1), n(2), n(3), n(4)), merged.toJavaList());
        assertSame(b, merged.tail().tail());
        assertSame(b, AlgoList.nil().append(b));
        assertEquals(List.of(n(1), n(2)), a.toJavaList());
    }

    @Test
    void listEquality_isStructural() {
        assertEquals(AlgoList.of(n(1), n(2)), AlgoList.nil().cons(n(2)).cons(n(1)));
        assertNotEquals(AlgoList.of(n(1)), AlgoList.of(n(1), n(2)));
        assertEquals(AlgoList.of(n(1)).hashCode(), AlgoList.of(Value.number(1.0)).hashCode());
        assertEquals("[1, 2]", AlgoList.of(n(1), n(2)).toString());
    }

    @Test
    void tree_sizeHeightAndAccessors() {
        AlgoTree l = AlgoTree.node(AlgoTree.leaf(), n(10), AlgoTree.leaf());
        AlgoTree r = AlgoTree.node(AlgoTree.leaf(), n(40), AlgoTree.leaf());
        AlgoTree t = AlgoTree.node(l, n(30), r);

        assertEquals(3, t.size());
        assertEquals(2, t.height());
        assertEquals(0, AlgoTree.leaf().size());
        assertEquals(n(30), t.root());
        assertSame(l, t.left());
        assertSame(r, t.right());
        assertTrue(t.left().left().isLeaf());
        assertEquals("node(node(leaf, 10, leaf), 30, node(leaf, 40, leaf))", t.toString());
    }

    @Test
    void leaf_rejectsAccessors() {
        AlgoTree leaf = AlgoTree.leaf();
        EvalError e = assertThrows(EvalError.class, leaf::root);
        assertTrue(e.getMessage().contains("root() called on leaf"));
        assertThrows(EvalError.class, leaf::left);
        assertThrows(EvalError.class, leaf::right);
    }

    @Test
    void builtins_throughTheLanguage() {
        AlgoScript es = new AlgoScript();
        Environment env = es.newEnvironment();

        assertTrue(es.evaluate(env, "isEmpty(Nil())").asBool());
        assertFalse(es.evaluate(env, "isEmpty(cons(1, Nil))").asBool());
        assertEquals(1L, es.evaluate(env, "value([1, 2])").asLong());
        assertEquals(2L, es.evaluate(env, "value(tail([1, 2, 3]))").asLong());
        assertTrue(es.evaluate(env, "isEmpty(tail(tail(tail([1, 2, 3]))))").asBool());
        assertEquals(es.evaluate(env, "[2]"), es.evaluate(env, "tail([1, 2])"));
        assertEquals(es.evaluate(env, "[1, 2, 3]"), es.evaluate(env, "merge([1], [2, 3])"));
        assertTrue(es.evaluate(env, "isLeaf(leaf())").asBool());
        assertEquals(2L, es.evaluate(env, "size(node(node(leaf, 1, leaf), 2, leaf))").asLong());
        assertEquals(7L, es.evaluate(env, "root(left(node(node(leaf, 7, leaf), 8, leaf)))").asLong());
    }

    @Test
    void builtins_checkArgumentTypesAndCounts() {
        AlgoScript es = new AlgoScript();
        Environment env = es.newEnvironment();

        EvalError e1 = assertThrows(EvalError.class, () -> es.evaluate(env, "cons(1, 2)"));
        assertTrue(e1.getMessage().contains("cons() expects a list as argument 2, got integer"));

        EvalError e2 = assertThrows(EvalError.class, () -> es.evaluate(env, "size([1])"));
        assertTrue(e2.getMessage().contains("size() expects a tree as argument 1, got list"));

        EvalError e3 = assertThrows(EvalError.class, () -> es.evaluate(env, "node(leaf, 1)"));
        assertTrue(e3.getMessage().contains("node() expects 3 arguments, got 2"));

        assertThrows(EvalError.class, () -> es.evaluate(env, "right(leaf)"));
        assertThrows(EvalError.class, () -> es.evaluate(env, "tail(Nil)"));
    }
}
