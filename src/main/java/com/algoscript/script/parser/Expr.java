package com.algoscript.script.parser;

import java.util.List;

public class Expr {

    public interface ExprInterface {
        <R> R accept(ExprVisitor<R> visitor);
    }

    public interface ExprVisitor<R> {
        R visitBinaryExpr(Binary expr);
        R visitUnaryExpr(Unary expr);
        R visitLiteralExpr(Literal expr);
        R visitListLiteralExpr(ListLiteral expr);
        R visitVariableExpr(Variable expr);
        R visitLogicalExpr(Logical expr);
        R visitComparisonExpr(Comparison expr);
        R visitConditionalExpr(Conditional expr);
        R visitCallExpr(Call expr);
    }

    // -------------------------
    // Core expression nodes
    // -------------------------

    /** Arithmetic: + - * / %. */
    public static final class Binary implements ExprInterface {
        public final ExprInterface left;
        public final Token operator;
        public final ExprInterface right;

        public Binary(ExprInterface left, Token operator, ExprInterface right) {
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBinaryExpr(this);
        }
    }

    /** Prefix {@code not} (BANG) and unary minus. */
    public static final class Unary implements ExprInterface {
        public final Token operator;
        public final ExprInterface right;

        public Unary(Token operator, ExprInterface right) {
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitUnaryExpr(this);
        }
    }

    public static final class Literal implements ExprInterface {
        public final Value value;

        public Literal(Value value) {
            this.value = value;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLiteralExpr(this);
        }
    }

    /** {@code [a, b, c]}, built into a List with {@code a} at the head. */
    public static final class ListLiteral implements ExprInterface {
        public final List<ExprInterface> items;

        public ListLiteral(List<ExprInterface> items) {
            this.items = items;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitListLiteralExpr(this);
        }
    }

    public static final class Variable implements ExprInterface {
        public final Token name;

        public Variable(Token name) {
            this.name = name;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitVariableExpr(this);
        }
    }

    /** Short-circuit {@code and} (AND_AND) / {@code or} (OR_OR). */
    public static final class Logical implements ExprInterface {
        public final ExprInterface left;
        public final Token operator;
        public final ExprInterface right;

        public Logical(ExprInterface left, Token operator, ExprInterface right) {
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLogicalExpr(this);
        }
    }

    /**
     * A comparison chain: {@code a < b <= c} holds operands [a, b, c] and operators [<, <=].
     * A plain comparison is a chain of two operands.
     */
    public static final class Comparison implements ExprInterface {
        public final List<ExprInterface> operands;
        public final List<Token> operators;

        public Comparison(List<ExprInterface> operands, List<Token> operators) {
            this.operands = operands;
            this.operators = operators;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitComparisonExpr(this);
        }
    }

    /** {@code thenValue if condition else elseValue}. */
    public static final class Conditional implements ExprInterface {
        public final ExprInterface condition;
        public final ExprInterface thenValue;
        public final ExprInterface elseValue;

        public Conditional(ExprInterface condition, ExprInterface thenValue, ExprInterface elseValue) {
            this.condition = condition;
            this.thenValue = thenValue;
            this.elseValue = elseValue;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitConditionalExpr(this);
        }
    }

    public static final class Call implements ExprInterface {
        public final Token callee;
        public final List<ExprInterface> arguments;

        public Call(Token callee, List<ExprInterface> arguments) {
            this.callee = callee;
            this.arguments = arguments;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitCallExpr(this);
        }
    }
}
