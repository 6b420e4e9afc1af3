import org.junit.jupiter.api.Test;

import com.algoscript.script.AlgoScript;
import com.algoscript.script.parser.AlgoTree;
import com.algoscript.script.parser.Value;
import com.algoscript.script.render.TreeRenderer;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TreeRendererTest {

    private static AlgoTree tree(String expr) {
        AlgoScript es = new AlgoScript();
        return es.evaluate(es.newEnvironment(), expr).asTree();
    }

    @Test
    void leaf_rendersNothing() {
        assertEquals(List.of(), TreeRenderer.render(AlgoTree.leaf()));
    }

    @Test
    void singleNode_isJustItsLabel() {
        assertEquals(List.of("5"), TreeRenderer.render(tree("node(leaf, 5, leaf)")));
    }

    @Test
    void balancedThreeNodes() {
        assertEquals(List.of(
                "  2",
                " / \\",
                "1   3"),
                TreeRenderer.render(tree("node(node(leaf,1,leaf),2,node(leaf,3,leaf))")));
    }

    @Test
    void leftOnlyChild_drawsOneConnector() {
        assertEquals(List.of(
                "  2",
                " /",
                "1"),
                TreeRenderer.render(tree("node(node(leaf,1,leaf),2,leaf)")));
    }

    @Test
    void deeperTree_keepsSubtreesApart() {
        List<String> lines = TreeRenderer.render(tree(
                "node(node(node(leaf,10,leaf),20,node(leaf,25,leaf)),30,node(leaf,40,leaf))"));
        assertEquals(List.of(
                "         30",
                "      /    \\",
                "   20       40",
                " /   \\",
                "10    25"),
                lines);
    }

    @Test
    void wideLabels_doNotOverlap() {
        assertEquals(List.of(
                "    1",
                "  /   \\",
                "100   200"),
                TreeRenderer.render(tree("node(node(leaf,100,leaf),1,node(leaf,200,leaf))")));
    }

    @Test
    void stringLabels_areUnquoted_andNonTreesRenderAsText() {
        assertEquals(List.of("ab"), TreeRenderer.render(tree("node(leaf, 'ab', leaf)")));
        assertEquals(List.of("7"), TreeRenderer.render(Value.integer(7)));
        assertEquals("  2\n / \\\n1   3",
                TreeRenderer.renderToString(tree("node(node(leaf,1,leaf),2,node(leaf,3,leaf))")));
    }

    @Test
    void rowCount_followsHeight() {
        AlgoTree t = tree("node(leaf,1,node(leaf,2,node(leaf,3,node(leaf,4,leaf))))");
        List<String> lines = TreeRenderer.render(t);
        assertEquals(2 * t.height() - 1, lines.size());
        for (String line : lines) assertFalse(line.endsWith(" "));
    }
}
