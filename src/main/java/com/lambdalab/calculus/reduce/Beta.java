package com.lambdalab.calculus.reduce;

import com.lambdalab.calculus.ast.Expr;
import com.lambdalab.calculus.ast.RedexPath;
import com.lambdalab.calculus.ast.Substitution;

/** Redex rules shared by every strategy. */
final class Beta {

    private Beta() {}

    /** The abstraction {@code fn} is or resolves to through MacroRefs, else null. */
    static Expr.Abs asAbstraction(Expr fn) {
        Expr cur = fn;
        while (cur instanceof Expr.MacroRef) cur = ((Expr.MacroRef) cur).resolved;
        return (cur instanceof Expr.Abs) ? (Expr.Abs) cur : null;
    }

    /** {@code (λx.b) a -> b[x := a]} */
    static Step fire(Expr.Abs abs, Expr arg) {
        return new Step(Substitution.substitute(abs.body, abs.param, arg), RedexPath.ROOT);
    }

    /** A macro name stepping to the body it stands for. */
    static Step unfold(Expr.MacroRef ref) {
        return new Step(ref.resolved, RedexPath.ROOT);
    }
}
