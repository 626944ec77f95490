package com.lambdalab.calculus.macro;

import com.lambdalab.calculus.reduce.Trace;

/**
 * Outcome of a macro definition: the stored definition and the trace of the
 * reduction that produced its value, or an error kind and message.
 */
public final class DefinitionResult {
    private final String name;
    private final MacroDefinition definition;
    private final Trace trace;
    private final DefinitionError error;
    private final String message;
    private final int pos;

    private DefinitionResult(String name, MacroDefinition definition, Trace trace,
                             DefinitionError error, String message, int pos) {
        this.name = name;
        this.definition = definition;
        this.trace = trace;
        this.error = error;
        this.message = message;
        this.pos = pos;
    }

    public static DefinitionResult success(MacroDefinition definition, Trace trace) {
        return new DefinitionResult(definition.name(), definition, trace, null, null, -1);
    }

    public static DefinitionResult failure(String name, DefinitionError error, String message) {
        return failure(name, error, message, -1);
    }

    public static DefinitionResult failure(String name, DefinitionError error, String message, int pos) {
        return new DefinitionResult(name, null, null, error, message, pos);
    }

    public boolean isSuccess() { return error == null; }

    public String name() { return name; }

    /** Null on failure. */
    public MacroDefinition definition() { return definition; }

    /** Null on failure. */
    public Trace trace() { return trace; }

    /** Null on success. */
    public DefinitionError error() { return error; }

    public String message() { return message; }

    /** Source offset for syntax-level failures, -1 otherwise. */
    public int pos() { return pos; }

    @Override
    public String toString() {
        return isSuccess() ? "defined " + definition.render() : error + ": " + message;
    }
}
