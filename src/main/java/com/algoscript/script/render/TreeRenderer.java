package com.algoscript.script.render;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.algoscript.script.parser.AlgoTree;
import com.algoscript.script.parser.Value;

/**
 * Draws a binary tree as ASCII art, root on top:
 *
 * <pre>
 *          30
 *       /    \
 *    20       40
 *  /   \
 * 10    25
 * </pre>
 *
 * Columns come from an in-order walk, so every node sits to the right of its whole left
 * subtree and to the left of its whole right subtree and labels never overlap. Each level
 * takes two rows: the labels, then the connectors down to the next level, each placed
 * halfway between the parent's centre and the child's. Leaves draw nothing.
 */
public final class TreeRenderer {

    /** Blank columns between neighbouring labels. */
    private static final int GAP = 1;

    private TreeRenderer() {}

    public static List<String> render(AlgoTree tree) {
        if (tree.isLeaf()) return Collections.emptyList();

        List<Placed> placed = new ArrayList<>();
        int width = layout(tree, 0, 0, placed);
        int rows = 2 * tree.height() - 1;

        char[][] grid = new char[rows][width];
        for (char[] row : grid) Arrays.fill(row, ' ');

        for (Placed p : placed) {
            p.label.getChars(0, p.label.length(), grid[2 * p.depth], p.start);
            if (p.leftCenter >= 0) grid[2 * p.depth + 1][(p.center() + p.leftCenter) / 2] = '/';
            if (p.rightCenter >= 0) grid[2 * p.depth + 1][(p.center() + p.rightCenter + 1) / 2] = '\\';
        }

        List<String> lines = new ArrayList<>(rows);
        for (char[] row : grid) lines.add(stripTrailing(new String(row)));
        return lines;
    }

    public static List<String> render(Value value) {
        if (value.getType() != Value.Type.TREE) return Collections.singletonList(label(value));
        return render(value.asTree());
    }

    public static String renderToString(AlgoTree tree) {
        return String.join("\n", render(tree));
    }

    /** Places the subtree starting at column {@code start}; returns the first free column after it. */
    private static int layout(AlgoTree t, int depth, int start, List<Placed> out) {
        Placed left = null;
        int cursor = start;
        if (!t.left().isLeaf()) {
            cursor = layout(t.left(), depth + 1, cursor, out);
            // the left child's in-order position, counted back over its right subtree
            left = out.get(out.size() - 1 - t.left().right().size());
            cursor += GAP;
        }

        Placed self = new Placed(label(t.root()), depth, cursor);
        out.add(self);
        cursor += self.label.length();

        if (!t.right().isLeaf()) {
            cursor += GAP;
            int before = out.size();
            cursor = layout(t.right(), depth + 1, cursor, out);
            self.rightCenter = out.get(before + t.right().left().size()).center();
        }
        if (left != null) self.leftCenter = left.center();
        return cursor;
    }

    private static String label(Value v) {
        if (v.getType() == Value.Type.STRING) return v.asString();
        return v.toString();
    }

    private static String stripTrailing(String s) {
        int end = s.length();
        while (end > 0 && s.charAt(end - 1) == ' ') end--;
        return s.substring(0, end);
    }

    private static final class Placed {
        final String label;
        final int depth;
        final int start;
        int leftCenter = -1;
        int rightCenter = -1;

        Placed(String label, int depth, int start) {
            this.label = label.isEmpty() ? "?" : label;
            this.depth = depth;
            this.start = start;
        }

        int center() {
            return start + (label.length() - 1) / 2;
        }
    }
}
