package com.lambdalab.calculus.reduce;

import com.lambdalab.calculus.ast.Expr;

/**
 * Normal order (full beta): leftmost-outermost, reducing under abstractions.
 * Finds the normal form whenever one exists.
 */
public final class NormalOrder implements Reducer, Expr.Visitor<Step> {

    public static final NormalOrder INSTANCE = new NormalOrder();

    private NormalOrder() {}

    @Override
    public Step step(Expr e) {
        return e.accept(this);
    }

    @Override
    public Step visitVar(Expr.Var expr) {
        return null;
    }

    @Override
    public Step visitAbs(Expr.Abs expr) {
        Step s = expr.body.accept(this);
        return s == null ? null : s.inBody(expr);
    }

    @Override
    public Step visitApp(Expr.App expr) {
        Expr.Abs abs = Beta.asAbstraction(expr.fn);
        if (abs != null) return Beta.fire(abs, expr.arg);

        Step s = expr.fn.accept(this);
        if (s != null) return s.inFn(expr);

        s = expr.arg.accept(this);
        return s == null ? null : s.inArg(expr);
    }

    @Override
    public Step visitMacroRef(Expr.MacroRef expr) {
        return Beta.unfold(expr);
    }
}
