package com.algoscript.protocol.util;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import com.algoscript.script.parser.AlgoList;
import com.algoscript.script.parser.AlgoTree;
import com.algoscript.script.parser.Value;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Converts between interpreter values and Jackson trees.
 *
 * Lists are JSON arrays, trees are {@code {"_type":"node","left":..,"value":..,"right":..}}
 * objects with {@code {"_type":"leaf"}} for empty subtrees, Nil and None are {@code null}.
 */
public final class ValueJson {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private ValueJson() {}

    public static JsonNode toJson(Value v) {
        switch (v.getType()) {
            case NONE:
                return NODES.nullNode();
            case BOOL:
                return NODES.booleanNode(v.asBool());
            case NUMBER:
                return v.isInteger() ? NODES.numberNode(v.asLong()) : NODES.numberNode(v.asNumber());
            case STRING:
                return NODES.textNode(v.asString());
            case LIST: {
                AlgoList list = v.asList();
                if (list.isEmpty()) return NODES.nullNode();
                ArrayNode out = NODES.arrayNode();
                for (Value e : list) {
                    JsonNode j = toJson(e);
                    // null elements are dropped
                    if (!j.isNull()) out.add(j);
                }
                return out;
            }
            case TREE:
                return treeToJson(v.asTree());
            case ERROR: {
                ObjectNode out = NODES.objectNode();
                out.put("error", v.asError().message.replace('\n', ' '));
                return out;
            }
            default:
                throw new IllegalArgumentException("ValueJson: unsupported type " + v.getType());
        }
    }

    private static JsonNode treeToJson(AlgoTree t) {
        ObjectNode out = NODES.objectNode();
        if (t.isLeaf()) {
            out.put("_type", "leaf");
            return out;
        }
        out.put("_type", "node");
        out.set("left", treeToJson(t.left()));
        out.set("value", toJson(t.root()));
        out.set("right", treeToJson(t.right()));
        return out;
    }

    /**
     * Converts a JSON argument into a value. Text nodes go through {@code strings}, which decides
     * whether the text is an expression or a plain string.
     */
    public static Value fromJson(JsonNode j, Function<String, Value> strings) {
        if (j == null || j.isNull() || j.isMissingNode()) return Value.nil();
        if (j.isBoolean()) return Value.bool(j.booleanValue());
        if (j.isIntegralNumber()) {
            if (!j.canConvertToLong()) throw new IllegalArgumentException("ValueJson: integer out of range: " + j);
            return Value.integer(j.longValue());
        }
        if (j.isNumber()) return Value.number(j.doubleValue());
        if (j.isTextual()) return strings.apply(j.textValue());

        if (j.isArray()) {
            List<Value> items = new ArrayList<>(j.size());
            for (JsonNode e : j) items.add(fromJson(e, strings));
            return Value.list(AlgoList.of(items));
        }

        if (j.isObject()) {
            AlgoTree t = treeFromJson(j, strings);
            if (t != null) return Value.tree(t);
            throw new IllegalArgumentException("ValueJson: object argument must carry _type leaf or node, got " + fieldNames(j));
        }

        throw new IllegalArgumentException("ValueJson: unsupported JSON node " + j.getNodeType());
    }

    private static AlgoTree treeFromJson(JsonNode j, Function<String, Value> strings) {
        if (j == null || j.isNull()) return AlgoTree.leaf();
        String type = j.path("_type").asText("");
        if ("leaf".equals(type)) return AlgoTree.leaf();
        if (!"node".equals(type)) return null;

        AlgoTree left = treeFromJson(j.get("left"), strings);
        AlgoTree right = treeFromJson(j.get("right"), strings);
        if (left == null || right == null) {
            throw new IllegalArgumentException("ValueJson: node children must be trees");
        }
        return AlgoTree.node(left, fromJson(j.get("value"), strings), right);
    }

    private static List<String> fieldNames(JsonNode j) {
        List<String> names = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> it = j.fields();
        while (it.hasNext()) names.add(it.next().getKey());
        return names;
    }
}
