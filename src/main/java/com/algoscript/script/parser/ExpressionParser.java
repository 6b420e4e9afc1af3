package com.algoscript.script.parser;

import java.util.ArrayList;
import java.util.List;

import com.algoscript.script.parser.Expr.Binary;
import com.algoscript.script.parser.Expr.Call;
import com.algoscript.script.parser.Expr.Comparison;
import com.algoscript.script.parser.Expr.Conditional;
import com.algoscript.script.parser.Expr.ExprInterface;
import com.algoscript.script.parser.Expr.ListLiteral;
import com.algoscript.script.parser.Expr.Literal;
import com.algoscript.script.parser.Expr.Logical;
import com.algoscript.script.parser.Expr.Unary;
import com.algoscript.script.parser.Expr.Variable;

/**
 * Recursive-descent expression parser, one method per precedence level, loosest first:
 * conditional ({@code a if c else b}), or, and, not, comparison, additive, multiplicative,
 * unary minus, then calls and primaries.
 */
public class ExpressionParser {
    private final List<Token> tokens;
    private int current = 0;

    public ExpressionParser(List<Token> tokens) { this.tokens = tokens; }

    /** Lexes and parses a complete expression found on {@code line}. */
    public static ExprInterface parse(String text, int line) {
        return new ExpressionParser(new Lexer(text, line).tokenize()).parseExpression();
    }

    /** Lexes and parses a comma separated argument list (no surrounding parentheses). */
    public static List<ExprInterface> parseList(String text, int line) {
        return new ExpressionParser(new Lexer(text, line).tokenize()).parseArguments();
    }

    public ExprInterface parseExpression() {
        ExprInterface expr = expression();
        if (!isAtEnd()) throw error(peek(), "Unexpected '" + peek().lexeme + "' after expression.");
        return expr;
    }

    public List<ExprInterface> parseArguments() {
        List<ExprInterface> items = new ArrayList<>();
        if (isAtEnd()) return items;
        do {
            items.add(expression());
        } while (match(TokenType.COMMA));
        if (!isAtEnd()) throw error(peek(), "Unexpected '" + peek().lexeme + "' in argument list.");
        return items;
    }

    private ExprInterface expression() { return conditional(); }

    private ExprInterface conditional() {
        ExprInterface expr = or();
        if (matchWord("if")) {
            ExprInterface condition = or();
            if (!matchWord("else")) throw error(peek(), "Expect 'else' in conditional expression.");
            ExprInterface otherwise = conditional();
            return new Conditional(condition, expr, otherwise);
        }
        return expr;
    }

    private ExprInterface or() {
        ExprInterface expr = and();
        while (match(TokenType.OR_OR) || matchWord("or") || matchWord("OR")) {
            Token op = normalized(TokenType.OR_OR);
            ExprInterface right = and();
            expr = new Logical(expr, op, right);
        }
        return expr;
    }

    private ExprInterface and() {
        ExprInterface expr = not();
        while (match(TokenType.AND_AND) || matchWord("and") || matchWord("AND")) {
            Token op = normalized(TokenType.AND_AND);
            ExprInterface right = not();
            expr = new Logical(expr, op, right);
        }
        return expr;
    }

    private ExprInterface not() {
        if (match(TokenType.BANG) || matchWord("not") || matchWord("NOT")) {
            Token op = normalized(TokenType.BANG);
            ExprInterface right = not();
            return new Unary(op, right);
        }
        return comparison();
    }

    private ExprInterface comparison() {
        ExprInterface expr = term();
        if (!checkComparison()) return expr;

        List<ExprInterface> operands = new ArrayList<>();
        List<Token> operators = new ArrayList<>();
        operands.add(expr);
        while (checkComparison()) {
            operators.add(advance());
            operands.add(term());
        }
        return new Comparison(operands, operators);
    }

    private ExprInterface term() {
        ExprInterface expr = factor();
        while (match(TokenType.PLUS, TokenType.MINUS)) {
            Token op = previous();
            ExprInterface right = factor();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private ExprInterface factor() {
        ExprInterface expr = unary();
        while (match(TokenType.STAR, TokenType.SLASH, TokenType.PERCENT)) {
            Token op = previous();
            ExprInterface right = unary();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private ExprInterface unary() {
        if (match(TokenType.MINUS)) {
            Token op = previous();
            ExprInterface right = unary();
            return new Unary(op, right);
        }
        return primary();
    }

    private ExprInterface primary() {
        if (match(TokenType.NUMBER)) {
            Object lit = previous().literal;
            if (lit instanceof Long) return new Literal(Value.integer((Long) lit));
            return new Literal(Value.number((Double) lit));
        }
        if (match(TokenType.STRING)) return new Literal(Value.string((String) previous().literal));

        if (match(TokenType.IDENTIFIER)) {
            Token name = previous();
            if (match(TokenType.LEFT_PAREN)) return finishCall(name);

            Value constant = constant(name.lexeme);
            if (constant != null) return new Literal(constant);
            return new Variable(name);
        }

        if (match(TokenType.LEFT_PAREN)) {
            ExprInterface expr = expression();
            consume(TokenType.RIGHT_PAREN, "Expect ')' after expression.");
            return expr;
        }

        if (match(TokenType.LEFT_BRACKET)) {
            List<ExprInterface> items = new ArrayList<>();
            if (!check(TokenType.RIGHT_BRACKET)) {
                do {
                    items.add(expression());
                } while (match(TokenType.COMMA));
            }
            consume(TokenType.RIGHT_BRACKET, "Expect ']' after list literal.");
            return new ListLiteral(items);
        }

        if (isAtEnd()) throw error(peek(), "Expect expression, got end of line.");
        throw error(peek(), "Expect expression, got '" + peek().lexeme + "'.");
    }

    private ExprInterface finishCall(Token callee) {
        List<ExprInterface> arguments = new ArrayList<>();

        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                arguments.add(expression());
            } while (match(TokenType.COMMA));
        }

        consume(TokenType.RIGHT_PAREN, "Expect ')' after arguments of " + callee.lexeme + ".");
        return new Call(callee, arguments);
    }

    private static Value constant(String word) {
        switch (word) {
            case "true": case "True": return Value.bool(true);
            case "false": case "False": return Value.bool(false);
            case "None": return Value.none();
            case "Nil": return Value.nil();
            case "leaf": return Value.leaf();
            default: return null;
        }
    }

    private boolean checkComparison() {
        if (isAtEnd()) return false;
        switch (peek().type) {
            case LESS: case LESS_EQUAL: case GREATER: case GREATER_EQUAL:
            case EQUAL_EQUAL: case BANG_EQUAL:
                return true;
            default:
                return false;
        }
    }

    /** The operator just consumed, retyped so word and symbol spellings evaluate alike. */
    private Token normalized(TokenType type) {
        Token op = previous();
        return op.type == type ? op : new Token(type, op.lexeme, null, op.line);
    }

    private boolean matchWord(String word) {
        if (isAtEnd() || !peek().isWord(word)) return false;
        advance();
        return true;
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) return advance();
        throw error(peek(), message);
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() { return peek().type == TokenType.EOF; }
    private Token peek() { return tokens.get(current); }
    private Token previous() { return tokens.get(current - 1); }

    private ParseError error(Token token, String message) {
        return new ParseError(message, token.line);
    }
}
