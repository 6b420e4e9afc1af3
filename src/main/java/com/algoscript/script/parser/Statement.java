package com.algoscript.script.parser;

import java.util.List;

public class Statement {

    public interface Stmt {
        void accept(StmtVisitor visitor);

        /** 1-based line of the statement (or of its header) in the program source. */
        int line();
    }

    public interface StmtVisitor {
        void visitExprStmt(ExprStmt stmt);
        void visitAssignStmt(AssignStmt stmt);
        void visitIfStmt(If stmt);
        void visitWhileStmt(While stmt);
        void visitForRangeStmt(ForRange stmt);
        void visitForInStmt(ForIn stmt);
        void visitReturnStmt(ReturnStmt stmt);
    }

    /** A bare expression, typically a call whose value is discarded. */
    public static final class ExprStmt implements Stmt {
        final Expr.ExprInterface expression;
        final int line;
        ExprStmt(Expr.ExprInterface expression, int line) {
            this.expression = expression;
            this.line = line;
        }
        public void accept(StmtVisitor visitor) { visitor.visitExprStmt(this); }
        public int line() { return line; }
    }

    /** {@code let x = e}, {@code x ← e}, {@code x = e}: binds into the innermost scope. */
    public static final class AssignStmt implements Stmt {
        public final String target;
        final Expr.ExprInterface value;
        final int line;
        AssignStmt(String target, Expr.ExprInterface value, int line) {
            this.target = target;
            this.value = value;
            this.line = line;
        }
        public void accept(StmtVisitor visitor) { visitor.visitAssignStmt(this); }
        public int line() { return line; }
    }

    /** One {@code if}/{@code elseif} arm. */
    public static final class Branch {
        final Expr.ExprInterface condition;
        public final List<Stmt> body;
        Branch(Expr.ExprInterface condition, List<Stmt> body) {
            this.condition = condition;
            this.body = body;
        }
    }

    public static final class If implements Stmt {
        public final List<Branch> branches;
        public final List<Stmt> elseBody; // null when there is no else
        final int line;
        If(List<Branch> branches, List<Stmt> elseBody, int line) {
            this.branches = branches;
            this.elseBody = elseBody;
            this.line = line;
        }
        public void accept(StmtVisitor visitor) { visitor.visitIfStmt(this); }
        public int line() { return line; }
    }

    public static final class While implements Stmt {
        final Expr.ExprInterface condition;
        public final List<Stmt> body;
        final int line;
        While(Expr.ExprInterface condition, List<Stmt> body, int line) {
            this.condition = condition;
            this.body = body;
            this.line = line;
        }
        public void accept(StmtVisitor visitor) { visitor.visitWhileStmt(this); }
        public int line() { return line; }
    }

    /** {@code for v from a to b do}: inclusive, ascending. */
    public static final class ForRange implements Stmt {
        public final String variable;
        final Expr.ExprInterface from;
        final Expr.ExprInterface to;
        public final List<Stmt> body;
        final int line;
        ForRange(String variable, Expr.ExprInterface from, Expr.ExprInterface to, List<Stmt> body, int line) {
            this.variable = variable;
            this.from = from;
            this.to = to;
            this.body = body;
            this.line = line;
        }
        public void accept(StmtVisitor visitor) { visitor.visitForRangeStmt(this); }
        public int line() { return line; }
    }

    /** {@code for v in listExpr do}: head to tail. */
    public static final class ForIn implements Stmt {
        public final String variable;
        final Expr.ExprInterface iterable;
        public final List<Stmt> body;
        final int line;
        ForIn(String variable, Expr.ExprInterface iterable, List<Stmt> body, int line) {
            this.variable = variable;
            this.iterable = iterable;
            this.body = body;
            this.line = line;
        }
        public void accept(StmtVisitor visitor) { visitor.visitForInStmt(this); }
        public int line() { return line; }
    }

    public static final class ReturnStmt implements Stmt {
        final Expr.ExprInterface value; // may be null
        final int line;

        ReturnStmt(Expr.ExprInterface value, int line) {
            this.value = value;
            this.line = line;
        }

        public void accept(StmtVisitor visitor) { visitor.visitReturnStmt(this); }
        public int line() { return line; }
    }
}
