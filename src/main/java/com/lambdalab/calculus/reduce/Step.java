package com.lambdalab.calculus.reduce;

import com.lambdalab.calculus.ast.Expr;
import com.lambdalab.calculus.ast.RedexPath;

/** Outcome of one reduction: the new tree and where in the old tree the redex was. */
public final class Step {
    public final Expr result;
    public final RedexPath redex;

    public Step(Expr result, RedexPath redex) {
        this.result = result;
        this.redex = redex;
    }

    Step inFn(Expr.App parent) {
        return new Step(new Expr.App(result, parent.arg), redex.prepend(RedexPath.Direction.FN));
    }

    Step inArg(Expr.App parent) {
        return new Step(new Expr.App(parent.fn, result), redex.prepend(RedexPath.Direction.ARG));
    }

    Step inBody(Expr.Abs parent) {
        return new Step(new Expr.Abs(parent.param, result), redex.prepend(RedexPath.Direction.BODY));
    }
}
