package com.lambdalab.calculus.parser;

public enum TokenType {
    IDENTIFIER,
    LAMBDA,
    DOT,
    LEFT_PAREN,
    RIGHT_PAREN,
    DEFINE,
    EOF
}
