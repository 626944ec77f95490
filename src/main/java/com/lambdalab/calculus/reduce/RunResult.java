package com.lambdalab.calculus.reduce;

import com.lambdalab.calculus.ast.Expr;

/**
 * Outcome of {@link Runner#run}. {@link #finalExpr()} is null when the budget
 * ran out first; the trace is then only the observed prefix, not a value.
 */
public final class RunResult {
    private final Trace trace;
    private final Expr finalExpr;

    RunResult(Trace trace, Expr finalExpr) {
        this.trace = trace;
        this.finalExpr = finalExpr;
    }

    public Trace trace() { return trace; }

    public Expr finalExpr() { return finalExpr; }

    public boolean timedOut() { return finalExpr == null; }

    /** Number of reductions performed. */
    public int stepsTaken() {
        return timedOut() ? trace.size() : trace.size() - 1;
    }
}
