package com.lambdalab.calculus.parser;

import java.util.List;

import com.lambdalab.calculus.ast.Expr;
import com.lambdalab.calculus.macro.MacroTable;
import com.lambdalab.calculus.reduce.Strategy;

/**
 * Recursive-descent parser for the plain lambda calculus.
 *
 * <pre>
 *   definition := IDENT ('=' | '≜') expr
 *   expr       := term term*            (left-associative application)
 *   term       := IDENT | ('\' | 'λ') IDENT '.' expr | '(' expr ')'
 * </pre>
 *
 * Identifiers starting with an uppercase letter name macros and are resolved
 * against the table for the given strategy while parsing.
 */
public class Parser {
    private final List<Token> tokens;
    private final MacroTable macros;
    private final Strategy strategy;
    private int current = 0;

    public Parser(List<Token> tokens, MacroTable macros, Strategy strategy) {
        this.tokens = tokens;
        this.macros = macros;
        this.strategy = (strategy == null) ? Strategy.NORMAL : strategy;
    }

    /** Convenience: lex and parse a whole expression. */
    public static Expr parse(String source, MacroTable macros, Strategy strategy) {
        return new Parser(new Lexer(source).tokenize(), macros, strategy).parse();
    }

    /** A parsed {@code NAME = body} line. */
    public static final class Definition {
        public final String name;
        public final Expr body;

        Definition(String name, Expr body) {
            this.name = name;
            this.body = body;
        }
    }

    public Expr parse() {
        Expr expr = expression();
        if (!isAtEnd()) throw error(peek(), "unexpected token");
        return expr;
    }

    public Definition parseDefinition() {
        Token name = consume(TokenType.IDENTIFIER, "expected macro name");
        consume(TokenType.DEFINE, "expected = after macro name");
        Expr body = parse();
        return new Definition(name.lexeme, body);
    }

    private Expr expression() {
        Expr out = term();
        if (out == null) throw error(peek(), "expected term");
        while (true) {
            Expr next = term();
            if (next == null) return out;
            out = new Expr.App(out, next);
        }
    }

    private Expr term() {
        if (match(TokenType.IDENTIFIER)) return identifier(previous());
        if (match(TokenType.LAMBDA)) return abstraction();
        if (match(TokenType.LEFT_PAREN)) {
            Expr inner = expression();
            consume(TokenType.RIGHT_PAREN, "unbalanced parentheses");
            return inner;
        }
        return null;
    }

    private Expr abstraction() {
        Token param = consume(TokenType.IDENTIFIER, "expected variable name after lambda");
        consume(TokenType.DOT, "expected dot after variable name");
        return new Expr.Abs(param.lexeme, expression());
    }

    private Expr identifier(Token name) {
        if (!Character.isUpperCase(name.lexeme.charAt(0))) return new Expr.Var(name.lexeme);

        Expr.MacroRef ref = (macros == null) ? null : macros.reference(name.lexeme, strategy);
        if (ref == null) throw new UnboundMacroError(name.lexeme, name.pos);
        return ref;
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
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
        return new ParseError(message, token.pos);
    }
}
