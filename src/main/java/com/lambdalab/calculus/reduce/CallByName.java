package com.lambdalab.calculus.reduce;

import com.lambdalab.calculus.ast.Expr;

/**
 * Call-by-name: the leftmost-outermost redex fires with its argument
 * unevaluated. Arguments are copied, not shared, so a duplicated argument is
 * reduced again at each use. Never reduces under an abstraction or inside an
 * argument.
 */
public final class CallByName implements Reducer, Expr.Visitor<Step> {

    public static final CallByName INSTANCE = new CallByName();

    private CallByName() {}

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
        return null;
    }

    @Override
    public Step visitApp(Expr.App expr) {
        Expr.Abs abs = Beta.asAbstraction(expr.fn);
        if (abs != null) return Beta.fire(abs, expr.arg);

        Step s = expr.fn.accept(this);
        return s == null ? null : s.inFn(expr);
    }

    @Override
    public Step visitMacroRef(Expr.MacroRef expr) {
        return Beta.unfold(expr);
    }
}
