package com.lambdalab.calculus.parser;

/** Reference to a macro name that has not been defined. */
public class UnboundMacroError extends ParseError {
    private final String name;

    public UnboundMacroError(String name, int pos) {
        super("undefined macro " + name, pos);
        this.name = name;
    }

    public String name() { return name; }
}
