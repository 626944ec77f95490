package com.lambdalab.calculus.reduce;

import com.lambdalab.calculus.ast.Expr;

/**
 * Call-by-value: the function side is reduced first, then the argument, and
 * a redex fires only once its argument is a value. Never reduces under an
 * abstraction.
 *
 * Values are variables, abstractions and macro references whose body is a
 * value.
 */
public final class CallByValue implements Reducer, Expr.Visitor<Step> {

    public static final CallByValue INSTANCE = new CallByValue();

    private CallByValue() {}

    public static boolean isValue(Expr e) {
        Expr cur = e;
        while (cur instanceof Expr.MacroRef) cur = ((Expr.MacroRef) cur).resolved;
        return cur instanceof Expr.Var || cur instanceof Expr.Abs;
    }

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
        if (abs != null) {
            if (isValue(expr.arg)) return Beta.fire(abs, expr.arg);
            Step s = expr.arg.accept(this);
            return s == null ? null : s.inArg(expr);
        }

        Step s = expr.fn.accept(this);
        if (s != null) return s.inFn(expr);

        // stuck head: the argument may still reduce
        if (!isValue(expr.arg)) {
            s = expr.arg.accept(this);
            if (s != null) return s.inArg(expr);
        }
        return null;
    }

    @Override
    public Step visitMacroRef(Expr.MacroRef expr) {
        return Beta.unfold(expr);
    }
}
