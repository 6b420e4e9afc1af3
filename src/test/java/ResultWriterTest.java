import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.algoscript.protocol.CaseFileParser;
import com.algoscript.protocol.CaseRunner;
import com.algoscript.protocol.ResultWriter;
import com.algoscript.script.AlgoScript;
import com.algoscript.script.DirectiveResult;
import com.algoscript.script.parser.Environment;
import com.algoscript.script.parser.Value;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ResultWriterTest {

    private static final String PROGRAM =
            "Algorithm: Sum(N)\n" +
            "    return 0 if N<=0 else N+Sum(N-1)\n" +
            "Algorithm: Insert(T, x)\n" +
            "    if isLeaf(T) then\n" +
            "        return node(leaf, x, leaf)\n" +
            "    elseif x < root(T) then\n" +
            "        return node(Insert(left(T), x), root(T), right(T))\n" +
            "    else\n" +
            "        return node(left(T), root(T), Insert(right(T), x))\n" +
            "    endif\n" +
            "Algorithm: Length(L)\n" +
            "    if isEmpty(L) then\n" +
            "        return 0\n" +
            "    endif\n" +
            "    return 1 + Length(tail(L))\n";

    private AlgoScript es;
    private Environment env;

    @BeforeEach
    void setUp() {
        es = new AlgoScript();
        env = es.loadProgram(PROGRAM);
    }

    private String run(String caseText) throws Exception {
        List<DirectiveResult> results =
                new CaseRunner(es, env).runAll(new CaseFileParser(null).parse(caseText));
        return ResultWriter.write(results);
    }

    @Test
    void singleScalar_isWrittenAlone() throws Exception {
        assertEquals("6", run("Sum: 3\n"));
    }

    @Test
    void severalOutputs_oneJsonPerLine_assignmentsSilent() throws Exception {
        assertEquals("6\n[1,2]\n\"ab\"\nnull\ntrue",
                run("n = 3\nSum(n)\n[1, None, 2]\n'a' + 'b'\nNil\n1 < 2\n"));
    }

    @Test
    void singleListOutput_isWrappedInTheOutputArray() throws Exception {
        assertEquals("[[1,2]]", run("merge([1], [2])\n"));
    }

    @Test
    void noOutputs_isEmptyArray() throws Exception {
        assertEquals("[]", run("x = 1\n"));
    }

    @Test
    void failures_becomeErrorObjects_andRunContinues() throws Exception {
        assertEquals("{\"error\":\"Unknown function: Nope\"}\n1",
                run("Nope(1)\nSum(1)\n"));
    }

    @Test
    void malformedJsonCase_isReportedAndRunContinues() throws Exception {
        assertEquals("6\n"
                + "{\"error\":\"Case must be a directive string or an object with \\\"algo\\\", got: {\\\"args\\\":[1]}\"}\n"
                + "1",
                run("[\"Sum: 3\", {\"args\": [1]}, \"Sum(1)\"]"));
    }

    @Test
    void treeOutputs_getVisualizationSection() throws Exception {
        String out = run(
                "T = Insert(Insert(Insert(leaf, 2), 1), 3)\n" +
                "Sum: 2\n" +
                "T\n");
        String json = "{\"_type\":\"node\",\"left\":{\"_type\":\"node\",\"left\":{\"_type\":\"leaf\"},\"value\":1,"
                + "\"right\":{\"_type\":\"leaf\"}},\"value\":2,\"right\":{\"_type\":\"node\",\"left\":{\"_type\":\"leaf\"},"
                + "\"value\":3,\"right\":{\"_type\":\"leaf\"}}}";
        assertEquals("3\n" + json + "\n\n"
                + ResultWriter.TREE_HEADING + "\n\n"
                + "Case 2:\n  2\n / \\\n1   3\n\n", out);
    }

    @Test
    void jsonInvocation_convertsArgumentsAndStoresResult() throws Exception {
        String out = run(
                "{\"algo\": \"Length\", \"args\": [[1, 2, null, 3]]}\n" +
                "{\"algo\": \"Insert\", \"args\": [{\"_type\": \"leaf\"}, 5], \"store\": \"T\"}\n" +
                "{\"algo\": \"Sum\", \"args\": [\"size(T) + 1\"]}\n" +
                "{\"algo\": \"Length\", \"args\": [\"not an expression (\"]}\n");

        String[] lines = out.split("\n");
        assertEquals("4", lines[0]);
        assertTrue(lines[1].startsWith("{\"_type\":\"node\""));
        assertEquals("3", lines[2]);
        assertTrue(lines[3].startsWith("{\"error\":"));
        assertTrue(lines[3].contains("isEmpty() expects a list as argument 1, got string"));

        assertEquals(Value.Type.TREE, env.getGlobal("T").getType());
        assertEquals(1, env.getGlobal("T").asTree().size());
    }

    @Test
    void jsonTreeArgument_roundTripsThroughTheEngine() throws Exception {
        String out = run(
                "{\"algo\": \"Insert\", \"args\": [{\"_type\": \"node\", \"left\": {\"_type\": \"leaf\"}, "
                        + "\"value\": 2, \"right\": null}, 1]}\n");
        assertTrue(out.startsWith("{\"_type\":\"node\",\"left\":{\"_type\":\"node\""));
        assertTrue(out.contains(ResultWriter.TREE_HEADING));
        assertTrue(out.endsWith("Case 1:\n  2\n /\n1\n\n"));
    }

    @Test
    void badJsonArgument_isErrorResult() throws Exception {
        String out = run("{\"algo\": \"Sum\", \"args\": [{\"x\": 1}]}\n");
        assertTrue(out.startsWith("{\"error\":\"Bad argument for Sum"));
    }
}
