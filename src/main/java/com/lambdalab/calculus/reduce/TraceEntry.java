package com.lambdalab.calculus.reduce;

import com.lambdalab.calculus.ast.Expr;
import com.lambdalab.calculus.ast.Printer;
import com.lambdalab.calculus.ast.RedexPath;

/** One snapshot of a run: the expression and the redex that fired from it (null for the last one). */
public final class TraceEntry {
    private final Expr expr;
    private final RedexPath redex;

    public TraceEntry(Expr expr, RedexPath redex) {
        this.expr = expr;
        this.redex = redex;
    }

    public Expr expr() { return expr; }
    public RedexPath redex() { return redex; }

    public String render() { return Printer.render(expr); }
    public String renderHighlighted() { return Printer.render(expr, redex); }

    @Override
    public String toString() {
        return render();
    }
}
