package com.lambdalab.calculus.parser;

/** Syntax error at a source offset. */
public class ParseError extends RuntimeException {
    private final String msg;
    private final int pos;

    public ParseError(String msg, int pos) {
        super("[pos " + pos + "] " + msg);
        this.msg = msg;
        this.pos = pos;
    }

    /** Message without the position prefix. */
    public String msg() { return msg; }

    public int pos() { return pos; }
}
