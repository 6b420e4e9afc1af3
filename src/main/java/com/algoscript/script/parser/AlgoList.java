package com.algoscript.script.parser;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Persistent singly-linked list: either {@code Nil} or a cons cell of a head value and a
 * tail list. Tails are shared between lists, never copied, and a list can only be grown by
 * prepending, so every list is a finite chain ending in {@code Nil}.
 */
public final class AlgoList implements Iterable<Value> {

    private static final AlgoList NIL = new AlgoList(null, null, 0);

    private final Value head;
    private final AlgoList tail;
    private final int size;

    private AlgoList(Value head, AlgoList tail, int size) {
        this.head = head;
        this.tail = tail;
        this.size = size;
    }

    public static AlgoList nil() {
        return NIL;
    }

    /** Builds a list holding {@code elements} in order. */
    public static AlgoList of(List<Value> elements) {
        AlgoList result = NIL;
        for (int i = elements.size() - 1; i >= 0; i--) {
            result = result.cons(elements.get(i));
        }
        return result;
    }

    public static AlgoList of(Value... elements) {
        return of(List.of(elements));
    }

    public AlgoList cons(Value element) {
        return new AlgoList(element, this, size + 1);
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public int size() {
        return size;
    }

    public Value head() {
        if (isEmpty()) throw new EvalError("value() called on Nil");
        return head;
    }

    public AlgoList tail() {
        if (isEmpty()) throw new EvalError("tail() called on Nil");
        return tail;
    }

    /**
     * This list's elements, in order, followed by {@code other}. Only this list's cells are
     * rebuilt; {@code other} becomes the shared tail.
     */
    public AlgoList append(AlgoList other) {
        if (isEmpty()) return other;
        if (other.isEmpty()) return this;

        List<Value> elements = toJavaList();
        AlgoList result = other;
        for (int i = elements.size() - 1; i >= 0; i--) {
            result = result.cons(elements.get(i));
        }
        return result;
    }

    public List<Value> toJavaList() {
        List<Value> out = new ArrayList<>(size);
        for (Value v : this) out.add(v);
        return out;
    }

    @Override
    public Iterator<Value> iterator() {
        return new Iterator<Value>() {
            private AlgoList current = AlgoList.this;

            @Override
            public boolean hasNext() {
                return !current.isEmpty();
            }

            @Override
            public Value next() {
                if (current.isEmpty()) throw new NoSuchElementException();
                Value v = current.head;
                current = current.tail;
                return v;
            }
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AlgoList)) return false;
        AlgoList a = this;
        AlgoList b = (AlgoList) o;
        if (a.size != b.size) return false;
        while (!a.isEmpty()) {
            if (a == b) return true;
            if (!a.head.equals(b.head)) return false;
            a = a.tail;
            b = b.tail;
        }
        return true;
    }

    @Override
    public int hashCode() {
        int h = 1;
        for (Value v : this) h = 31 * h + v.hashCode();
        return h;
    }

    @Override
    public String toString() {
        if (isEmpty()) return "Nil";
        StringBuilder sb = new StringBuilder("[");
        boolean first = true;
        for (Value v : this) {
            if (!first) sb.append(", ");
            sb.append(v);
            first = false;
        }
        return sb.append(']').toString();
    }
}
