package com.algoscript.script.parser;

import java.util.Objects;

/**
 * Runtime value: a closed set of variants tagged by {@link Type}. Values never change
 * after construction; every operation builds a new one.
 *
 * NUMBER holds a {@code Long} for integers and a {@code Double} otherwise.
 */
public class Value {
    public enum Type { NUMBER, BOOL, STRING, LIST, TREE, NONE, ERROR }

    private static final Value NONE = new Value(Type.NONE, null);
    private static final Value TRUE = new Value(Type.BOOL, Boolean.TRUE);
    private static final Value FALSE = new Value(Type.BOOL, Boolean.FALSE);

    public final Type type;
    public final Object value;

    private Value(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static Value integer(long l) { return new Value(Type.NUMBER, l); }
    public static Value number(double d) { return new Value(Type.NUMBER, d); }
    public static Value bool(boolean b) { return b ? TRUE : FALSE; }
    public static Value string(String s) { return new Value(Type.STRING, Objects.requireNonNull(s)); }
    public static Value list(AlgoList l) { return new Value(Type.LIST, Objects.requireNonNull(l)); }
    public static Value tree(AlgoTree t) { return new Value(Type.TREE, Objects.requireNonNull(t)); }
    public static Value none() { return NONE; }

    /** The empty list {@code Nil}. */
    public static Value nil() { return list(AlgoList.nil()); }

    /** The empty tree {@code leaf}. */
    public static Value leaf() { return tree(AlgoTree.leaf()); }

    /** A failed directive, as handed back to the caller instead of a result. */
    public static Value error(AlgoScriptException.Kind kind, String message) {
        return new Value(Type.ERROR, new ErrorInfo(kind, message));
    }

    /** Payload of an ERROR value. */
    public static final class ErrorInfo {
        public final AlgoScriptException.Kind kind;
        public final String message;

        ErrorInfo(AlgoScriptException.Kind kind, String message) {
            this.kind = kind;
            this.message = message;
        }

        @Override
        public String toString() {
            return kind + ": " + message;
        }
    }

    public Type getType() { return type; }

    public boolean isInteger() {
        return type == Type.NUMBER && value instanceof Long;
    }

    public double asNumber() {
        if (type != Type.NUMBER) throw mismatch("number");
        return ((Number) value).doubleValue();
    }

    public long asLong() {
        if (!isInteger()) throw mismatch("integer");
        return (Long) value;
    }

    public boolean asBool() {
        if (type != Type.BOOL) throw mismatch("bool");
        return (Boolean) value;
    }

    public String asString() {
        if (type != Type.STRING) throw mismatch("string");
        return (String) value;
    }

    public AlgoList asList() {
        if (type != Type.LIST) throw mismatch("list");
        return (AlgoList) value;
    }

    public AlgoTree asTree() {
        if (type != Type.TREE) throw mismatch("tree");
        return (AlgoTree) value;
    }

    public ErrorInfo asError() {
        if (type != Type.ERROR) throw mismatch("error");
        return (ErrorInfo) value;
    }

    /** Display name of the variant, as used in error messages. */
    public String typeName() {
        switch (type) {
            case NUMBER: return isInteger() ? "integer" : "float";
            case BOOL:   return "bool";
            case STRING: return "string";
            case LIST:   return ((AlgoList) value).isEmpty() ? "Nil" : "list";
            case TREE:   return ((AlgoTree) value).isLeaf() ? "leaf" : "tree";
            case NONE:   return "None";
            default:     return "error";
        }
    }

    private EvalError mismatch(String expected) {
        return new EvalError("Expected " + expected + ", got " + typeName());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Value)) return false;
        Value other = (Value) o;
        if (type == Type.NUMBER && other.type == Type.NUMBER) {
            if (isInteger() && other.isInteger()) return value.equals(other.value);
            return asNumber() == other.asNumber();
        }
        if (type != other.type) return false;
        if (type == Type.ERROR) return this == other;
        return Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        if (type == Type.NUMBER) {
            double d = asNumber();
            // 2 and 2.0 compare equal, so they must hash alike
            if (d == Math.rint(d) && !Double.isInfinite(d)) return Long.hashCode((long) d);
            return Double.hashCode(d);
        }
        return Objects.hash(type, value);
    }

    @Override
    public String toString() {
        switch (type) {
            case NUMBER:
                return value.toString();
            case BOOL:
                return Boolean.toString(asBool());
            case STRING:
                return '"' + asString() + '"';
            case LIST:
                return asList().toString();
            case TREE:
                return asTree().toString();
            case ERROR:
                return "error(" + asError() + ")";
            default:
                return "None";
        }
    }
}
