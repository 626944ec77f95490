package com.lambdalab.calculus.reduce;

import com.lambdalab.calculus.ast.Expr;

/**
 * Applicative order: innermost-leftmost. Function and argument are brought to
 * normal form (including under abstractions) before the enclosing redex
 * fires.
 */
public final class ApplicativeOrder implements Reducer, Expr.Visitor<Step> {

    public static final ApplicativeOrder INSTANCE = new ApplicativeOrder();

    private ApplicativeOrder() {}

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
        Step s = expr.fn.accept(this);
        if (s != null) return s.inFn(expr);

        s = expr.arg.accept(this);
        if (s != null) return s.inArg(expr);

        Expr.Abs abs = Beta.asAbstraction(expr.fn);
        return abs == null ? null : Beta.fire(abs, expr.arg);
    }

    @Override
    public Step visitMacroRef(Expr.MacroRef expr) {
        return Beta.unfold(expr);
    }
}
