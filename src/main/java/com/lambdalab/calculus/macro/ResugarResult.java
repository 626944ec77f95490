package com.lambdalab.calculus.macro;

import com.lambdalab.calculus.ast.Expr;

public final class ResugarResult {
    private final Expr expr;
    private final boolean changed;

    ResugarResult(Expr expr, boolean changed) {
        this.expr = expr;
        this.changed = changed;
    }

    public Expr expr() { return expr; }

    /** False when no subterm matched a macro; {@link #expr()} is then the input itself. */
    public boolean changed() { return changed; }
}
