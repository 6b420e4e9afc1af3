package com.algoscript.script.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.algoscript.script.parser.Expr.ExprInterface;
import com.algoscript.script.parser.Statement.AssignStmt;
import com.algoscript.script.parser.Statement.Branch;
import com.algoscript.script.parser.Statement.ExprStmt;
import com.algoscript.script.parser.Statement.ForIn;
import com.algoscript.script.parser.Statement.ForRange;
import com.algoscript.script.parser.Statement.If;
import com.algoscript.script.parser.Statement.ReturnStmt;
import com.algoscript.script.parser.Statement.Stmt;
import com.algoscript.script.parser.Statement.While;

/**
 * Groups the lines of one algorithm body into a statement tree.
 *
 * Lines are scanned in order with a stack of open block headers: {@code if}, {@code while}
 * and {@code for} push a frame, {@code elseif}/{@code else} switch the open {@code if} to its
 * next arm, and {@code endif}/{@code endwhile}/{@code endfor} pop the matching frame and add
 * the finished statement to the enclosing body. Keywords are case-insensitive.
 */
public class StatementParser {

    private static final Pattern LABEL = Pattern.compile("^(?:step\\s*\\d+\\s*:|\\d+\\s*:)\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern CONTRACT = Pattern.compile("^(?:requires|returns)\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern IF = Pattern.compile("^if\\b\\s*(.*?)\\s*(?:\\bthen)?$", Pattern.CASE_INSENSITIVE);
    private static final Pattern ELSEIF = Pattern.compile("^(?:elseif|else\\s+if)\\b\\s*(.*?)\\s*(?:\\bthen)?$", Pattern.CASE_INSENSITIVE);
    private static final Pattern ELSE = Pattern.compile("^else$", Pattern.CASE_INSENSITIVE);
    private static final Pattern ENDIF = Pattern.compile("^end\\s*if$", Pattern.CASE_INSENSITIVE);
    private static final Pattern WHILE = Pattern.compile("^while\\b\\s*(.*?)\\s*(?:\\bdo)?$", Pattern.CASE_INSENSITIVE);
    private static final Pattern ENDWHILE = Pattern.compile("^end\\s*while$", Pattern.CASE_INSENSITIVE);
    private static final Pattern FOR = Pattern.compile("^for\\b.*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern FOR_RANGE = Pattern.compile(
            "^for\\s+([A-Za-z_]\\w*)\\s+from\\s+(.+?)\\s+to\\s+(.+?)(?:\\s+do)?$", Pattern.CASE_INSENSITIVE);
    private static final Pattern FOR_IN = Pattern.compile(
            "^for\\s+([A-Za-z_]\\w*)\\s+in\\s+(.+?)(?:\\s+do)?$", Pattern.CASE_INSENSITIVE);
    private static final Pattern ENDFOR = Pattern.compile("^end\\s*for$", Pattern.CASE_INSENSITIVE);
    private static final Pattern RETURN = Pattern.compile("^return\\b\\s*(.*)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern LET_WORD = Pattern.compile("^let\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern LET = Pattern.compile("^let\\s+([A-Za-z_]\\w*)\\s*=(?!=)\\s*(.*)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern ARROW = Pattern.compile("^([A-Za-z_]\\w*)\\s*(?:←|<-)\\s*(.*)$");
    private static final Pattern ASSIGN = Pattern.compile("^([A-Za-z_]\\w*)\\s*=(?!=)\\s*(.*)$");

    private final Deque<Frame> open = new ArrayDeque<>();
    private final List<Stmt> root = new ArrayList<>();

    private StatementParser() {}

    /** Parses body lines numbered 1..n, each either {@code "N: text"} or bare {@code "text"}. */
    public static List<Stmt> parseBody(List<String> lines) {
        List<SourceLine> numbered = new ArrayList<>(lines.size());
        for (int i = 0; i < lines.size(); i++) numbered.add(new SourceLine(i + 1, lines.get(i)));
        return parse(numbered);
    }

    public static List<Stmt> parse(List<SourceLine> lines) {
        StatementParser parser = new StatementParser();
        for (SourceLine line : lines) {
            String text = normalize(line.text);
            if (text.isEmpty()) continue;
            parser.line(text, line.number);
        }
        return parser.finish();
    }

    /**
     * Strips a trailing {@code #} comment (outside quotes), surrounding whitespace and any
     * {@code N:} / {@code Step N:} label. Requires/Returns lines normalize to the empty string.
     */
    static String normalize(String raw) {
        String text = stripComment(raw).trim();
        text = LABEL.matcher(text).replaceFirst("").trim();
        if (CONTRACT.matcher(text).find()) return "";
        if (text.startsWith("#")) return "";
        return text;
    }

    static String stripComment(String raw) {
        char quote = 0;
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (quote != 0) {
                if (c == quote) quote = 0;
            } else if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '#') {
                return raw.substring(0, i);
            }
        }
        return raw;
    }

    private void line(String text, int lineNo) {
        Matcher m;

        if ((m = IF.matcher(text)).matches()) {
            open.push(new IfFrame(expression(m.group(1), "if", lineNo), lineNo));
            return;
        }
        if ((m = ELSEIF.matcher(text)).matches()) {
            ifFrame("elseif", lineNo).elseIf(expression(m.group(1), "elseif", lineNo), lineNo);
            return;
        }
        if (ELSE.matcher(text).matches()) {
            ifFrame("else", lineNo).otherwise(lineNo);
            return;
        }
        if (ENDIF.matcher(text).matches()) {
            close("if", "endif", lineNo);
            return;
        }
        if ((m = WHILE.matcher(text)).matches()) {
            open.push(new WhileFrame(expression(m.group(1), "while", lineNo), lineNo));
            return;
        }
        if (ENDWHILE.matcher(text).matches()) {
            close("while", "endwhile", lineNo);
            return;
        }
        if (FOR.matcher(text).matches()) {
            open.push(forFrame(text, lineNo));
            return;
        }
        if (ENDFOR.matcher(text).matches()) {
            close("for", "endfor", lineNo);
            return;
        }
        if ((m = RETURN.matcher(text)).matches()) {
            String rest = m.group(1).trim();
            ExprInterface value = rest.isEmpty() ? null : ExpressionParser.parse(rest, lineNo);
            add(new ReturnStmt(value, lineNo));
            return;
        }
        if (LET_WORD.matcher(text).find()) {
            if (!(m = LET.matcher(text)).matches()) {
                throw new ParseError("Malformed let: expected 'let <name> = <expression>'", lineNo);
            }
            add(assignment(m, lineNo));
            return;
        }
        if ((m = ARROW.matcher(text)).matches() || (m = ASSIGN.matcher(text)).matches()) {
            add(assignment(m, lineNo));
            return;
        }
        add(new ExprStmt(ExpressionParser.parse(text, lineNo), lineNo));
    }

    private List<Stmt> finish() {
        if (!open.isEmpty()) {
            Frame f = open.peek();
            throw new ParseError("Unclosed '" + f.keyword + "' opened at line " + f.line
                    + ": missing '" + f.closer() + "'", f.line);
        }
        return root;
    }

    // -------------------------
    // Frames
    // -------------------------

    private void add(Stmt stmt) {
        if (open.isEmpty()) root.add(stmt);
        else open.peek().body().add(stmt);
    }

    private void close(String keyword, String closer, int lineNo) {
        if (open.isEmpty()) {
            throw new ParseError("'" + closer + "' without matching '" + keyword + "'", lineNo);
        }
        Frame top = open.peek();
        if (!top.keyword.equals(keyword)) {
            throw new ParseError("'" + closer + "' found while '" + top.keyword + "' opened at line "
                    + top.line + " is still open", lineNo);
        }
        open.pop();
        add(top.build());
    }

    private IfFrame ifFrame(String keyword, int lineNo) {
        if (open.isEmpty() || !(open.peek() instanceof IfFrame)) {
            throw new ParseError("'" + keyword + "' without matching 'if'", lineNo);
        }
        return (IfFrame) open.peek();
    }

    private Frame forFrame(String text, int lineNo) {
        Matcher m = FOR_RANGE.matcher(text);
        if (m.matches()) {
            return new ForRangeFrame(m.group(1),
                    expression(m.group(2), "from", lineNo),
                    expression(m.group(3), "to", lineNo), lineNo);
        }
        m = FOR_IN.matcher(text);
        if (m.matches()) {
            return new ForInFrame(m.group(1), expression(m.group(2), "in", lineNo), lineNo);
        }
        throw new ParseError("Malformed for: expected 'for <var> from <a> to <b> do' or 'for <var> in <list> do'", lineNo);
    }

    private static AssignStmt assignment(Matcher m, int lineNo) {
        String rhs = m.group(2).trim();
        if (rhs.isEmpty()) throw new ParseError("Missing expression in assignment to " + m.group(1), lineNo);
        return new AssignStmt(m.group(1), ExpressionParser.parse(rhs, lineNo), lineNo);
    }

    private static ExprInterface expression(String text, String after, int lineNo) {
        if (text == null || text.trim().isEmpty()) {
            throw new ParseError("Missing expression after '" + after + "'", lineNo);
        }
        return ExpressionParser.parse(text.trim(), lineNo);
    }

    private abstract static class Frame {
        final String keyword;
        final int line;

        Frame(String keyword, int line) {
            this.keyword = keyword;
            this.line = line;
        }

        String closer() { return "end" + keyword; }

        abstract List<Stmt> body();

        abstract Stmt build();
    }

    private static final class IfFrame extends Frame {
        private final List<Branch> branches = new ArrayList<>();
        private List<Stmt> current = new ArrayList<>();
        private ExprInterface currentCondition;
        private List<Stmt> elseBody;

        IfFrame(ExprInterface condition, int line) {
            super("if", line);
            this.currentCondition = condition;
        }

        void elseIf(ExprInterface condition, int lineNo) {
            if (elseBody != null) throw new ParseError("'elseif' after 'else' in 'if' opened at line " + line, lineNo);
            branches.add(new Branch(currentCondition, current));
            currentCondition = condition;
            current = new ArrayList<>();
        }

        void otherwise(int lineNo) {
            if (elseBody != null) throw new ParseError("Second 'else' in 'if' opened at line " + line, lineNo);
            branches.add(new Branch(currentCondition, current));
            currentCondition = null;
            elseBody = new ArrayList<>();
            current = elseBody;
        }

        List<Stmt> body() { return current; }

        Stmt build() {
            if (elseBody == null) branches.add(new Branch(currentCondition, current));
            return new If(List.copyOf(branches), elseBody, line);
        }
    }

    private static final class WhileFrame extends Frame {
        private final ExprInterface condition;
        private final List<Stmt> body = new ArrayList<>();

        WhileFrame(ExprInterface condition, int line) {
            super("while", line);
            this.condition = condition;
        }

        List<Stmt> body() { return body; }

        Stmt build() { return new While(condition, body, line); }
    }

    private static final class ForRangeFrame extends Frame {
        private final String variable;
        private final ExprInterface from;
        private final ExprInterface to;
        private final List<Stmt> body = new ArrayList<>();

        ForRangeFrame(String variable, ExprInterface from, ExprInterface to, int line) {
            super("for", line);
            this.variable = variable;
            this.from = from;
            this.to = to;
        }

        List<Stmt> body() { return body; }

        Stmt build() { return new ForRange(variable, from, to, body, line); }
    }

    private static final class ForInFrame extends Frame {
        private final String variable;
        private final ExprInterface iterable;
        private final List<Stmt> body = new ArrayList<>();

        ForInFrame(String variable, ExprInterface iterable, int line) {
            super("for", line);
            this.variable = variable;
            this.iterable = iterable;
        }

        List<Stmt> body() { return body; }

        Stmt build() { return new ForIn(variable, iterable, body, line); }
    }
}
