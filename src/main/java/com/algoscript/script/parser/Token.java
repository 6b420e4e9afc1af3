package com.algoscript.script.parser;

public class Token {
    final TokenType type;
    public final String lexeme;
    final Object literal;
    public final int line;

    Token(TokenType type, String lexeme, Object literal, int line) {
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal;
        this.line = line;
    }

    public TokenType type() { return type; }

    /** True for an identifier whose text is {@code word}; keywords are matched this way, case-sensitively. */
    public boolean isWord(String word) {
        return type == TokenType.IDENTIFIER && lexeme.equals(word);
    }

    @Override
    public String toString() {
        return type + " " + lexeme;
    }
}
