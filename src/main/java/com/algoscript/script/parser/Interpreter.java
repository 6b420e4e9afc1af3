package com.algoscript.script.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Supplier;

import com.algoscript.debug.Debug;
import com.algoscript.script.parser.Expr.Binary;
import com.algoscript.script.parser.Expr.Call;
import com.algoscript.script.parser.Expr.Comparison;
import com.algoscript.script.parser.Expr.Conditional;
import com.algoscript.script.parser.Expr.ExprInterface;
import com.algoscript.script.parser.Expr.ExprVisitor;
import com.algoscript.script.parser.Expr.ListLiteral;
import com.algoscript.script.parser.Expr.Literal;
import com.algoscript.script.parser.Expr.Logical;
import com.algoscript.script.parser.Expr.Unary;
import com.algoscript.script.parser.Expr.Variable;
import com.algoscript.script.parser.Statement.AssignStmt;
import com.algoscript.script.parser.Statement.Branch;
import com.algoscript.script.parser.Statement.ExprStmt;
import com.algoscript.script.parser.Statement.ForIn;
import com.algoscript.script.parser.Statement.ForRange;
import com.algoscript.script.parser.Statement.If;
import com.algoscript.script.parser.Statement.ReturnStmt;
import com.algoscript.script.parser.Statement.Stmt;
import com.algoscript.script.parser.Statement.StmtVisitor;
import com.algoscript.script.parser.Statement.While;

/**
 * Tree-walking executor. Statements mutate the current {@link Scope}; expressions are
 * evaluated against it. One interpreter belongs to one {@link Environment}.
 */
public class Interpreter implements ExprVisitor<Value>, StmtVisitor {

    private static final String TAG = "algoscript.exec";

    /** Host stack reserved per level of algorithm calls. */
    private static final long STACK_BYTES_PER_CALL = 64 * 1024;
    private static final long BASE_STACK_BYTES = 1024 * 1024;
    private static final long MAX_STACK_BYTES = 1024L * 1024 * 1024;

    private final Environment environment;
    private final Deque<CallFrame> callStack = new ArrayDeque<CallFrame>();
    private final int maxDepth;
    Scope scope;

    Interpreter(Environment environment, int maxDepth) {
        this.environment = environment;
        this.maxDepth = maxDepth;
        this.scope = environment.globalScope();
    }

    Environment environment() {
        return environment;
    }

    int maxDepth() {
        return maxDepth;
    }

    // -------------------------
    // Host entry points
    // -------------------------

    Value callForHost(String name, List<Value> args) {
        return onExecutionThread(() -> invokeByName(name, args));
    }

    Value evaluateForHost(ExprInterface expr) {
        return onExecutionThread(() -> eval(expr));
    }

    /**
     * Runs one top-level evaluation on a thread whose stack is sized for {@code maxDepth}
     * nested calls, and waits for it. Only one evaluation runs at a time.
     */
    private Value onExecutionThread(final Supplier<Value> work) {
        final Value[] result = new Value[1];
        final Throwable[] failure = new Throwable[1];

        Thread worker = new Thread(null, new Runnable() {
            @Override public void run() {
                enterTopLevel();
                try {
                    result[0] = work.get();
                } catch (StackOverflowError so) {
                    failure[0] = stackExhausted(so);
                } catch (Throwable t) {
                    failure[0] = t;
                } finally {
                    enterTopLevel();
                }
            }
        }, "algoscript-exec", stackBytes());

        worker.start();
        boolean interrupted = false;
        while (true) {
            try {
                worker.join();
                break;
            } catch (InterruptedException ie) {
                interrupted = true;
            }
        }
        if (interrupted) Thread.currentThread().interrupt();

        Throwable t = failure[0];
        if (t == null) return result[0];
        if (t instanceof RuntimeException) throw (RuntimeException) t;
        if (t instanceof Error) throw (Error) t;
        throw new IllegalStateException("Evaluation failed: " + t, t);
    }

    private long stackBytes() {
        return Math.min(MAX_STACK_BYTES, BASE_STACK_BYTES + (long) maxDepth * STACK_BYTES_PER_CALL);
    }

    private void enterTopLevel() {
        callStack.clear();
        scope = environment.globalScope();
    }

    private RecursionLimitError stackExhausted(StackOverflowError so) {
        String where = callStack.isEmpty() ? "" : " in " + callStack.peek();
        Debug.get().w(TAG, "Host stack exhausted at call depth " + callStack.size() + where);
        return new RecursionLimitError("Stack exhausted at call depth " + callStack.size() + where, so);
    }

    // -------------------------
    // Statements
    // -------------------------

    void executeBlock(List<Stmt> body) {
        for (Stmt s : body) {
            try {
                s.accept(this);
            } catch (EvalError e) {
                if (e.line() > 0) throw e;
                throw new EvalError(e.detail(), s.line(), e);
            }
        }
    }

    public void visitExprStmt(ExprStmt stmt) { eval(stmt.expression); }

    public void visitAssignStmt(AssignStmt stmt) {
        Value value = eval(stmt.value);
        scope.assign(stmt.target, value);
    }

    public void visitIfStmt(If stmt) {
        for (Branch branch : stmt.branches) {
            if (isTruthy(eval(branch.condition))) {
                executeBlock(branch.body);
                return;
            }
        }
        if (stmt.elseBody != null) executeBlock(stmt.elseBody);
    }

    public void visitWhileStmt(While stmt) {
        while (isTruthy(eval(stmt.condition))) {
            executeBlock(stmt.body);
        }
    }

    public void visitForRangeStmt(ForRange stmt) {
        long from = loopBound(eval(stmt.from), "from");
        long to = loopBound(eval(stmt.to), "to");
        for (long i = from; i <= to; i++) {
            scope.assign(stmt.variable, Value.integer(i));
            executeBlock(stmt.body);
            if (i == Long.MAX_VALUE) break;
        }
    }

    public void visitForInStmt(ForIn stmt) {
        Value iterable = eval(stmt.iterable);
        if (iterable.getType() != Value.Type.LIST) {
            throw new EvalError("for ... in expects a list, got " + iterable.typeName());
        }
        for (Value item : iterable.asList()) {
            scope.assign(stmt.variable, item);
            executeBlock(stmt.body);
        }
    }

    public void visitReturnStmt(ReturnStmt stmt) {
        throw new ReturnSignal(stmt.value == null ? Value.none() : eval(stmt.value));
    }

    private static long loopBound(Value v, String which) {
        if (v.getType() != Value.Type.NUMBER) {
            throw new EvalError("for loop '" + which + "' bound must be a number, got " + v.typeName());
        }
        if (v.isInteger()) return v.asLong();
        return (long) v.asNumber();
    }

    // -------------------------
    // Expressions
    // -------------------------

    public Value eval(ExprInterface expr) {
        return expr.accept(this);
    }

    public Value visitLiteralExpr(Literal expr) {
        return expr.value;
    }

    public Value visitListLiteralExpr(ListLiteral expr) {
        List<Value> values = new ArrayList<Value>(expr.items.size());
        for (ExprInterface e : expr.items) values.add(eval(e));
        return Value.list(AlgoList.of(values));
    }

    public Value visitVariableExpr(Variable expr) {
        return environment.lookupVariable(scope, expr.name.lexeme);
    }

    public Value visitLogicalExpr(Logical expr) {
        Value left = eval(expr.left);
        if (expr.operator.type == TokenType.OR_OR) {
            if (isTruthy(left)) return left;
        } else {
            if (!isTruthy(left)) return left;
        }
        return eval(expr.right);
    }

    public Value visitConditionalExpr(Conditional expr) {
        return isTruthy(eval(expr.condition)) ? eval(expr.thenValue) : eval(expr.elseValue);
    }

    public Value visitUnaryExpr(Unary expr) {
        Value right = eval(expr.right);
        switch (expr.operator.type) {
            case BANG:
                return Value.bool(!isTruthy(right));
            case MINUS:
                if (right.getType() != Value.Type.NUMBER) {
                    throw new EvalError("Unary '-' expects a number, got " + right.typeName());
                }
                if (right.isInteger()) return Value.integer(exact(() -> Math.negateExact(right.asLong())));
                return Value.number(-right.asNumber());
            default:
                throw new EvalError("Unsupported unary operator: " + expr.operator.lexeme);
        }
    }

    public Value visitBinaryExpr(Binary expr) {
        Value left = eval(expr.left);
        Value right = eval(expr.right);
        TokenType op = expr.operator.type;

        if (op == TokenType.PLUS && left.getType() == Value.Type.STRING && right.getType() == Value.Type.STRING) {
            return Value.string(left.asString() + right.asString());
        }
        requireNumbers(left, right, expr.operator);
        boolean ints = left.isInteger() && right.isInteger();

        switch (op) {
            case PLUS:
                if (ints) return Value.integer(exact(() -> Math.addExact(left.asLong(), right.asLong())));
                return Value.number(left.asNumber() + right.asNumber());
            case MINUS:
                if (ints) return Value.integer(exact(() -> Math.subtractExact(left.asLong(), right.asLong())));
                return Value.number(left.asNumber() - right.asNumber());
            case STAR:
                if (ints) return Value.integer(exact(() -> Math.multiplyExact(left.asLong(), right.asLong())));
                return Value.number(left.asNumber() * right.asNumber());
            case SLASH:
                return divide(left, right, ints);
            case PERCENT:
                return modulo(left, right, ints);
            default:
                throw new EvalError("Unsupported binary operator: " + expr.operator.lexeme);
        }
    }

    private static Value divide(Value left, Value right, boolean ints) {
        if (right.asNumber() == 0) throw new EvalError("Division by zero");
        if (ints) {
            long a = left.asLong();
            long b = right.asLong();
            if (a == Long.MIN_VALUE && b == -1) throw new EvalError("Integer overflow");
            if (a % b == 0) return Value.integer(a / b);
            return Value.number((double) a / b);
        }
        return Value.number(left.asNumber() / right.asNumber());
    }

    private static Value modulo(Value left, Value right, boolean ints) {
        if (right.asNumber() == 0) throw new EvalError("Modulo by zero");
        if (ints) return Value.integer(Math.floorMod(left.asLong(), right.asLong()));
        double a = left.asNumber();
        double b = right.asNumber();
        return Value.number(a - b * Math.floor(a / b));
    }

    public Value visitComparisonExpr(Comparison expr) {
        Value left = eval(expr.operands.get(0));
        for (int i = 0; i < expr.operators.size(); i++) {
            Value right = eval(expr.operands.get(i + 1));
            if (!compare(left, expr.operators.get(i), right)) return Value.bool(false);
            left = right;
        }
        return Value.bool(true);
    }

    private static boolean compare(Value left, Token operator, Value right) {
        switch (operator.type) {
            case EQUAL_EQUAL: return left.equals(right);
            case BANG_EQUAL:  return !left.equals(right);
            default:
                break;
        }
        int c = order(left, right, operator);
        switch (operator.type) {
            case LESS:          return c < 0;
            case LESS_EQUAL:    return c <= 0;
            case GREATER:       return c > 0;
            case GREATER_EQUAL: return c >= 0;
            default:
                throw new EvalError("Unsupported comparison operator: " + operator.lexeme);
        }
    }

    private static int order(Value left, Value right, Token operator) {
        if (left.getType() == Value.Type.NUMBER && right.getType() == Value.Type.NUMBER) {
            if (left.isInteger() && right.isInteger()) return Long.compare(left.asLong(), right.asLong());
            return Double.compare(left.asNumber(), right.asNumber());
        }
        if (left.getType() == Value.Type.STRING && right.getType() == Value.Type.STRING) {
            return left.asString().compareTo(right.asString());
        }
        throw new EvalError("Cannot compare " + left.typeName() + " " + operator.lexeme + " " + right.typeName());
    }

    public Value visitCallExpr(Call expr) {
        List<Value> args = new ArrayList<Value>(expr.arguments.size());
        for (ExprInterface a : expr.arguments) args.add(eval(a));
        return invokeByName(expr.callee.lexeme, args);
    }

    /** User-defined algorithms shadow built-ins of the same name. */
    Value invokeByName(String name, List<Value> args) {
        AlgorithmDefinition def = environment.definition(name);
        if (def != null) {
            if (callStack.size() >= maxDepth) {
                throw new RecursionLimitError("Max call depth " + maxDepth + " exceeded calling " + name
                        + (callStack.isEmpty() ? "" : " from " + callStack.peek()));
            }
            callStack.push(new CallFrame(name, args));
            try {
                return def.call(this, args);
            } catch (StackOverflowError so) {
                // converted here, while the frame that overflowed is still on the call stack
                throw stackExhausted(so);
            } finally {
                callStack.pop();
            }
        }

        BuiltinFunction fn = environment.builtin(name);
        if (fn != null) return fn.call(args);

        throw new EvalError("Unknown function: " + name);
    }

    // -------------------------
    // Helpers
    // -------------------------

    static boolean isTruthy(Value v) {
        switch (v.getType()) {
            case BOOL:   return v.asBool();
            case NONE:   return false;
            case NUMBER: return v.asNumber() != 0;
            case STRING: return !v.asString().isEmpty();
            default:     return true;
        }
    }

    private static void requireNumbers(Value left, Value right, Token operator) {
        if (left.getType() != Value.Type.NUMBER || right.getType() != Value.Type.NUMBER) {
            throw new EvalError("Unsupported operand types for '" + operator.lexeme + "': "
                    + left.typeName() + ", " + right.typeName());
        }
    }

    private interface LongOp {
        long apply();
    }

    private static long exact(LongOp op) {
        try {
            return op.apply();
        } catch (ArithmeticException e) {
            throw new EvalError("Integer overflow");
        }
    }

    public static final class ReturnSignal extends RuntimeException {
        private static final long serialVersionUID = 1L;
        final Value value;
        ReturnSignal(Value value) { super(null, null, false, false); this.value = value; }
    }
}
