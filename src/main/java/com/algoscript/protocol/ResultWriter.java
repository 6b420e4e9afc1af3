package com.algoscript.protocol;

import java.util.ArrayList;
import java.util.List;

import com.algoscript.protocol.util.ValueJson;
import com.algoscript.script.DirectiveResult;
import com.algoscript.script.parser.Value;
import com.algoscript.script.render.TreeRenderer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;

/**
 * Formats case results for the output file.
 *
 * Assignments print nothing. One non-array result is written alone, several results one JSON
 * document per line. Non-empty trees are then drawn under a {@code --- Tree Visualization ---}
 * heading, numbered by their position among the printed results.
 */
public final class ResultWriter {

    public static final String TREE_HEADING = "--- Tree Visualization ---";

    private static final ObjectMapper om = new ObjectMapper();

    private ResultWriter() {}

    public static String write(List<DirectiveResult> results) {
        List<Value> outputs = new ArrayList<>();
        for (DirectiveResult r : results) {
            if (!r.isAssignment()) outputs.add(r.value());
        }

        List<JsonNode> json = new ArrayList<>(outputs.size());
        for (Value v : outputs) json.add(ValueJson.toJson(v));

        StringBuilder sb = new StringBuilder();
        if (json.size() == 1 && !json.get(0).isArray()) {
            sb.append(toJson(json.get(0)));
        } else if (json.size() > 1) {
            for (int i = 0; i < json.size(); i++) {
                if (i > 0) sb.append('\n');
                sb.append(toJson(json.get(i)));
            }
        } else {
            ArrayNode all = om.createArrayNode();
            all.addAll(json);
            sb.append(toJson(all));
        }

        boolean hasTrees = false;
        for (Value v : outputs) {
            if (isNode(v)) hasTrees = true;
        }
        if (hasTrees) {
            sb.append("\n\n").append(TREE_HEADING).append("\n\n");
            for (int i = 0; i < outputs.size(); i++) {
                if (!isNode(outputs.get(i))) continue;
                sb.append("Case ").append(i + 1).append(":\n");
                sb.append(String.join("\n", TreeRenderer.render(outputs.get(i).asTree())));
                sb.append("\n\n");
            }
        }
        return sb.toString();
    }

    private static boolean isNode(Value v) {
        return v.getType() == Value.Type.TREE && !v.asTree().isLeaf();
    }

    private static String toJson(JsonNode n) {
        try {
            return om.writeValueAsString(n);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize result: " + e.getMessage(), e);
        }
    }
}
