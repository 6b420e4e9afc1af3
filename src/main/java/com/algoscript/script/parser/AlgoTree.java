package com.algoscript.script.parser;

import java.util.Objects;

/**
 * Persistent binary tree: either {@code leaf} or a node with a left subtree, a value and a
 * right subtree. Nodes are only ever composed from existing trees, so no cycles exist.
 */
public final class AlgoTree {

    private static final AlgoTree LEAF = new AlgoTree(null, null, null);

    private final AlgoTree left;
    private final Value value;
    private final AlgoTree right;

    private AlgoTree(AlgoTree left, Value value, AlgoTree right) {
        this.left = left;
        this.value = value;
        this.right = right;
    }

    public static AlgoTree leaf() {
        return LEAF;
    }

    public static AlgoTree node(AlgoTree left, Value value, AlgoTree right) {
        return new AlgoTree(Objects.requireNonNull(left), Objects.requireNonNull(value), Objects.requireNonNull(right));
    }

    public boolean isLeaf() {
        return this == LEAF;
    }

    public Value root() {
        if (isLeaf()) throw new EvalError("root() called on leaf");
        return value;
    }

    public AlgoTree left() {
        if (isLeaf()) throw new EvalError("left() called on leaf");
        return left;
    }

    public AlgoTree right() {
        if (isLeaf()) throw new EvalError("right() called on leaf");
        return right;
    }

    /** Number of nodes, leaves not counted. */
    public int size() {
        if (isLeaf()) return 0;
        return 1 + left.size() + right.size();
    }

    public int height() {
        if (isLeaf()) return 0;
        return 1 + Math.max(left.height(), right.height());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AlgoTree)) return false;
        AlgoTree other = (AlgoTree) o;
        if (isLeaf() || other.isLeaf()) return false;
        return value.equals(other.value) && left.equals(other.left) && right.equals(other.right);
    }

    @Override
    public int hashCode() {
        if (isLeaf()) return 0;
        return Objects.hash(left, value, right);
    }

    @Override
    public String toString() {
        if (isLeaf()) return "leaf";
        return "node(" + left + ", " + value + ", " + right + ")";
    }
}
