package com.algoscript.protocol;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.algoscript.debug.Debug;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads case files.
 *
 * A file is either one JSON document (an array of cases, or an object with a {@code cases}
 * array) or a list of lines:
 * <pre>
 *   # comment
 *   @other-case.json
 *   Sum: 10
 *   FindMax(T)
 *   T = node(node(leaf, 10, leaf), 20,
 *            node(leaf, 25, leaf))
 *   size(T) + 1
 *   {"algo": "Sum", "args": [3], "store": "s"}
 * </pre>
 * A line whose brackets are not balanced continues onto the following lines.
 */
public final class CaseFileParser {

    private static final String TAG = "algoscript.cases";
    private static final ObjectMapper om = new ObjectMapper();

    private final Path baseDir;

    /** @param baseDir directory that {@code @file} references resolve against, null for the working directory */
    public CaseFileParser(Path baseDir) {
        this.baseDir = baseDir;
    }

    public List<Case> parseFile(Path path) throws IOException {
        return parse(Files.readString(path, StandardCharsets.UTF_8));
    }

    public List<Case> parse(String text) throws IOException {
        if (text.startsWith("\uFEFF")) text = text.substring(1);

        List<Case> whole = parseWholeDocument(text);
        if (whole != null) return whole;

        List<Case> cases = new ArrayList<>();
        String[] lines = text.split("\\r?\\n", -1);
        int i = 0;
        while (i < lines.length) {
            String ln = lines[i].trim();
            i++;
            if (ln.isEmpty() || ln.startsWith("#")) continue;

            if (ln.startsWith("@")) {
                cases.addAll(parseReference(ln.substring(1).trim()));
                continue;
            }

            StringBuilder stmt = new StringBuilder(ln);
            while (depth(stmt) > 0 && i < lines.length) {
                stmt.append('\n').append(lines[i]);
                i++;
            }
            cases.add(parseEntry(stmt.toString()));
        }
        Debug.get().d(TAG, "Parsed " + cases.size() + " case(s)");
        return cases;
    }

    /**
     * Converts a parsed JSON case: a string is a directive, an object names {@code algo}.
     * Anything else becomes a malformed case so the rest of the file still runs.
     */
    public static Case fromJson(JsonNode j) {
        if (j.isTextual()) return Case.directive(j.textValue());
        if (j.isObject() && j.hasNonNull("algo")) {
            List<JsonNode> args = new ArrayList<>();
            JsonNode a = j.path("args");
            if (a.isArray()) {
                for (JsonNode e : a) args.add(e);
            } else if (!a.isMissingNode() && !a.isNull()) {
                args.add(a);
            }
            String store = j.hasNonNull("store") ? j.get("store").asText() : null;
            return Case.invocation(j.get("algo").asText(), args, store);
        }
        String problem = "Case must be a directive string or an object with \"algo\", got: " + j;
        Debug.get().w(TAG, problem);
        return Case.malformed(j.toString(), problem);
    }

    private List<Case> parseWholeDocument(String text) {
        String t = text.trim();
        if (!t.startsWith("[") && !t.startsWith("{")) return null;
        JsonNode doc;
        try {
            doc = om.readTree(t);
        } catch (JsonProcessingException e) {
            return null;
        }
        JsonNode list = doc.isObject() ? doc.get("cases") : doc;
        if (list == null || !list.isArray()) return null;
        // a bare list literal such as [1, 2] is a directive, not a case list
        for (JsonNode c : list) {
            if (!c.isObject() && !c.isTextual()) return null;
        }

        List<Case> out = new ArrayList<>();
        for (JsonNode c : list) out.add(fromJson(c));
        return out;
    }

    private List<Case> parseReference(String file) throws IOException {
        Path p = baseDir == null ? Path.of(file) : baseDir.resolve(file);
        String content = Files.readString(p, StandardCharsets.UTF_8).trim();
        try {
            JsonNode doc = om.readTree(content);
            if (doc.isArray()) {
                List<Case> out = new ArrayList<>();
                for (JsonNode c : doc) out.add(fromJson(c));
                return out;
            }
            if (doc.isObject() && doc.has("cases")) {
                List<Case> out = new ArrayList<>();
                for (JsonNode c : doc.get("cases")) out.add(fromJson(c));
                return out;
            }
            return List.of(fromJson(doc));
        } catch (JsonProcessingException e) {
            Debug.get().d(TAG, "@" + file + " is not JSON, reading it as a directive");
            return List.of(Case.directive(content));
        }
    }

    private static Case parseEntry(String stmt) {
        if (stmt.startsWith("{")) {
            try {
                JsonNode j = om.readTree(stmt);
                if (j.isObject() && j.hasNonNull("algo")) return fromJson(j);
            } catch (JsonProcessingException e) {
                Debug.get().d(TAG, "Line is not JSON, reading it as a directive: " + stmt);
            }
        }
        return Case.directive(stmt);
    }

    /** Open bracket count, ignoring brackets inside quotes. */
    static int depth(CharSequence s) {
        int depth = 0;
        char quote = 0;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (quote != 0) {
                if (c == quote) quote = 0;
                continue;
            }
            if (c == '"' || c == '\'') quote = c;
            else if (c == '(' || c == '[' || c == '{') depth++;
            else if (c == ')' || c == ']' || c == '}') depth--;
        }
        return depth;
    }
}
