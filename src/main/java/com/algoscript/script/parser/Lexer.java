package com.algoscript.script.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns one expression (or the expression part of a statement header) into tokens.
 * Words are never reserved here: {@code and}, {@code if}, {@code from} and friends come out
 * as identifiers and only the parsers give them meaning.
 */
public class Lexer {
    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private final int line;
    private int start = 0;
    private int current = 0;

    public Lexer(String source) {
        this(source, 0);
    }

    public Lexer(String source, int line) {
        this.source = source;
        this.line = line;
    }

    public List<Token> tokenize() {
        while (!isAtEnd()) {
            start = current;
            scanToken();
        }
        tokens.add(new Token(TokenType.EOF, "", null, line));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(': addToken(TokenType.LEFT_PAREN); break;
            case ')': addToken(TokenType.RIGHT_PAREN); break;
            case '[': addToken(TokenType.LEFT_BRACKET); break;
            case ']': addToken(TokenType.RIGHT_BRACKET); break;
            case ',': addToken(TokenType.COMMA); break;
            case '+': addToken(TokenType.PLUS); break;
            case '-': addToken(TokenType.MINUS); break;
            case '*': case '×': addToken(TokenType.STAR); break;
            case '/': case '÷': addToken(TokenType.SLASH); break;
            case '%': addToken(TokenType.PERCENT); break;
            case '!': addToken(match('=') ? TokenType.BANG_EQUAL : TokenType.BANG); break;
            case '=': addToken(match('=') ? TokenType.EQUAL_EQUAL : TokenType.EQUAL); break;
            case '<': addToken(match('=') ? TokenType.LESS_EQUAL : TokenType.LESS); break;
            case '>': addToken(match('=') ? TokenType.GREATER_EQUAL : TokenType.GREATER); break;
            case '≤': addToken(TokenType.LESS_EQUAL); break;
            case '≥': addToken(TokenType.GREATER_EQUAL); break;
            case '≠': addToken(TokenType.BANG_EQUAL); break;
            case '&':
                if (match('&')) addToken(TokenType.AND_AND);
                else throw error("Unexpected '&'");
                break;
            case '|':
                if (match('|')) addToken(TokenType.OR_OR);
                else throw error("Unexpected '|'");
                break;
            case ';':
                // stray ';' terminators are dropped
                break;
            case ' ': case '\r': case '\t': case '\n':
                break;
            case '"': case '\'':
                string(c);
                break;
            default:
                if (isDigit(c)) number();
                else if (isAlpha(c)) identifier();
                else throw error("Unexpected character: " + c);
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        // the modulo keyword is lexed straight into the operator it names
        if (text.equals("mod")) addToken(TokenType.PERCENT);
        else addToken(TokenType.IDENTIFIER);
    }

    private void number() {
        while (isDigit(peek())) advance();
        if (peek() == '.' && isDigit(peekNext())) {
            advance();
            while (isDigit(peek())) advance();
            addToken(TokenType.NUMBER, Double.parseDouble(source.substring(start, current)));
            return;
        }
        String digits = source.substring(start, current);
        try {
            addToken(TokenType.NUMBER, Long.parseLong(digits));
        } catch (NumberFormatException e) {
            throw error("Integer literal out of range: " + digits);
        }
    }

    private void string(char quote) {
        while (!isAtEnd() && peek() != quote) advance();
        if (isAtEnd()) throw error("Unterminated string");
        advance();
        String value = source.substring(start + 1, current - 1);
        addToken(TokenType.STRING, value);
    }

    private boolean isAtEnd() { return current >= source.length(); }
    private char advance() { return source.charAt(current++); }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        current++;
        return true;
    }

    private char peek() { return isAtEnd() ? '\0' : source.charAt(current); }
    private char peekNext() { return (current + 1 >= source.length()) ? '\0' : source.charAt(current + 1); }

    private boolean isDigit(char c) { return c >= '0' && c <= '9'; }
    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }
    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    private void addToken(TokenType type) { addToken(type, null); }
    private void addToken(TokenType type, Object literal) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, literal, line));
    }

    private LexError error(String msg) {
        return new LexError(msg, line);
    }
}
