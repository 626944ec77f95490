package com.lambdalab.calculus.parser;

import java.util.ArrayList;
import java.util.List;

public class Lexer {
    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;

    public Lexer(String source) {
        if (source == null) throw new IllegalArgumentException("source is null");
        this.source = source;
    }

    public List<Token> tokenize() {
        while (!isAtEnd()) {
            start = current;
            scanToken();
        }
        tokens.add(new Token(TokenType.EOF, "", current));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(': addToken(TokenType.LEFT_PAREN); break;
            case ')': addToken(TokenType.RIGHT_PAREN); break;
            case '.': addToken(TokenType.DOT); break;
            case '\\': addToken(TokenType.LAMBDA); break;
            case 'λ': addToken(TokenType.LAMBDA); break;
            case '=': addToken(TokenType.DEFINE); break;
            case '≜': addToken(TokenType.DEFINE); break;
            default:
                if (Character.isWhitespace(c)) break;
                if (isIdentChar(c)) identifier();
                else throw error("Unexpected character: " + c);
        }
    }

    private void identifier() {
        while (!isAtEnd() && isIdentChar(peek())) advance();
        addToken(TokenType.IDENTIFIER);
    }

    static boolean isIdentChar(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
    }

    private boolean isAtEnd() { return current >= source.length(); }
    private char advance() { return source.charAt(current++); }
    private char peek() { return source.charAt(current); }

    private void addToken(TokenType type) {
        tokens.add(new Token(type, source.substring(start, current), start));
    }

    private ParseError error(String msg) {
        return new ParseError(msg, start);
    }
}
