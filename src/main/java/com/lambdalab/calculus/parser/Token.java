package com.lambdalab.calculus.parser;

public class Token {
    final TokenType type;
    public final String lexeme;
    /** Offset of the first character in the source. */
    public final int pos;

    Token(TokenType type, String lexeme, int pos) {
        this.type = type;
        this.lexeme = lexeme;
        this.pos = pos;
    }

    public TokenType type() { return type; }

    @Override
    public String toString() {
        return type + " '" + lexeme + "' @" + pos;
    }
}
