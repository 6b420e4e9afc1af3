package com.algoscript.script.parser;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.algoscript.debug.Debug;

/**
 * Splits program text into {@code Algorithm:} blocks and parses each into an
 * {@link AlgorithmDefinition}. A block runs from its header to the next header or the end
 * of the text.
 */
public final class ProgramParser {

    private static final String TAG = "algoscript.load";

    private static final Pattern HEADER_START = Pattern.compile("^\\s*Algorithm\\b");
    private static final Pattern HEADER = Pattern.compile(
            "^\\s*Algorithm\\s*:?\\s*([A-Za-z_]\\w*)\\s*\\((.*?)\\)\\s*:?\\s*$");
    private static final Pattern IDENT = Pattern.compile("[A-Za-z_]\\w*");

    private ProgramParser() {}

    public static List<AlgorithmDefinition> parse(String source) {
        List<AlgorithmDefinition> out = new ArrayList<>();
        String[] lines = source.split("\\r?\\n", -1);

        SourceLine header = null;
        List<SourceLine> body = new ArrayList<>();

        for (int i = 0; i < lines.length; i++) {
            String raw = lines[i];
            if (i == 0 && raw.startsWith("\uFEFF")) raw = raw.substring(1);

            if (HEADER_START.matcher(raw).find()) {
                if (header != null) out.add(define(header, body));
                header = new SourceLine(i + 1, raw);
                body = new ArrayList<>();
            } else if (header != null) {
                body.add(new SourceLine(i + 1, raw));
            } else if (!StatementParser.normalize(raw).isEmpty()) {
                Debug.get().d(TAG, "Ignoring line " + (i + 1) + " outside any Algorithm block");
            }
        }
        if (header != null) out.add(define(header, body));
        return out;
    }

    private static AlgorithmDefinition define(SourceLine header, List<SourceLine> body) {
        Matcher m = HEADER.matcher(StatementParser.stripComment(header.text));
        if (!m.matches()) {
            throw new ParseError("Invalid algorithm header: expected 'Algorithm: Name(p1, p2, ...)', got '"
                    + header.text.trim() + "'", header.number);
        }
        String name = m.group(1);
        List<String> params = params(m.group(2), header.number);

        List<Statement.Stmt> stmts = StatementParser.parse(body);
        Debug.get().d(TAG, "Parsed algorithm " + name + params + " with " + stmts.size() + " top-level statements");
        return new AlgorithmDefinition(name, params, stmts, header.number);
    }

    private static List<String> params(String text, int lineNo) {
        List<String> params = new ArrayList<>();
        if (text.trim().isEmpty()) return params;

        Set<String> seen = new LinkedHashSet<>();
        for (String p : text.split(",")) {
            String name = p.trim();
            if (!IDENT.matcher(name).matches()) {
                throw new ParseError("Invalid parameter name '" + name + "'", lineNo);
            }
            if (!seen.add(name)) {
                throw new ParseError("Duplicate parameter name '" + name + "'", lineNo);
            }
            params.add(name);
        }
        return params;
    }
}
