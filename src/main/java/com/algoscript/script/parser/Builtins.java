package com.algoscript.script.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The fixed table of native functions over the two built-in data types.
 * Every function checks its argument count and the variant of each argument, failing with
 * an {@link EvalError} that names the function.
 */
public final class Builtins {

    private static final Map<String, BuiltinFunction> CORE;
    static {
        Map<String, BuiltinFunction> map = new LinkedHashMap<>();

        // Lists
        map.put("Nil", args -> {
            requireArgCount("Nil", args, 0);
            return Value.nil();
        });
        map.put("cons", args -> {
            requireArgCount("cons", args, 2);
            return Value.list(list("cons", args, 1).cons(args.get(0)));
        });
        map.put("isEmpty", args -> {
            requireArgCount("isEmpty", args, 1);
            return Value.bool(list("isEmpty", args, 0).isEmpty());
        });
        map.put("value", args -> {
            requireArgCount("value", args, 1);
            return list("value", args, 0).head();
        });
        map.put("tail", args -> {
            requireArgCount("tail", args, 1);
            return Value.list(list("tail", args, 0).tail());
        });
        map.put("merge", args -> {
            requireArgCount("merge", args, 2);
            return Value.list(list("merge", args, 0).append(list("merge", args, 1)));
        });

        // Trees
        map.put("leaf", args -> {
            requireArgCount("leaf", args, 0);
            return Value.leaf();
        });
        map.put("node", args -> {
            requireArgCount("node", args, 3);
            return Value.tree(AlgoTree.node(tree("node", args, 0), args.get(1), tree("node", args, 2)));
        });
        map.put("isLeaf", args -> {
            requireArgCount("isLeaf", args, 1);
            return Value.bool(tree("isLeaf", args, 0).isLeaf());
        });
        map.put("root", args -> {
            requireArgCount("root", args, 1);
            return tree("root", args, 0).root();
        });
        map.put("left", args -> {
            requireArgCount("left", args, 1);
            return Value.tree(tree("left", args, 0).left());
        });
        map.put("right", args -> {
            requireArgCount("right", args, 1);
            return Value.tree(tree("right", args, 0).right());
        });
        map.put("size", args -> {
            requireArgCount("size", args, 1);
            return Value.integer(tree("size", args, 0).size());
        });

        CORE = Collections.unmodifiableMap(map);
    }

    private Builtins() {}

    public static Map<String, BuiltinFunction> core() {
        return CORE;
    }

    private static void requireArgCount(String name, List<Value> args, int n) {
        if (args.size() != n) {
            throw new EvalError(name + "() expects " + n + " argument" + (n == 1 ? "" : "s") + ", got " + args.size());
        }
    }

    private static AlgoList list(String fn, List<Value> args, int i) {
        Value v = args.get(i);
        if (v.getType() != Value.Type.LIST) {
            throw new EvalError(fn + "() expects a list as argument " + (i + 1) + ", got " + v.typeName());
        }
        return v.asList();
    }

    private static AlgoTree tree(String fn, List<Value> args, int i) {
        Value v = args.get(i);
        if (v.getType() != Value.Type.TREE) {
            throw new EvalError(fn + "() expects a tree as argument " + (i + 1) + ", got " + v.typeName());
        }
        return v.asTree();
    }
}
