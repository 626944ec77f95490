package com.lambdalab.calculus.macro;

import java.util.List;

import com.lambdalab.calculus.ast.AlphaEquivalence;
import com.lambdalab.calculus.ast.Expr;
import com.lambdalab.calculus.reduce.Strategy;

/**
 * Folds reduced output back into macro names.
 *
 * The tree is searched outside-in. A subterm alpha-equivalent to the value a
 * macro resolves to under the strategy becomes a reference to that macro and
 * is not searched further, so only the largest match is folded. When several
 * macros share a value the one earliest in dependency order wins.
 */
public final class Resugarer implements Expr.Visitor<Expr> {

    private final List<MacroDefinition> macros;
    private final Strategy strategy;
    private boolean changed = false;

    private Resugarer(List<MacroDefinition> macros, Strategy strategy) {
        this.macros = macros;
        this.strategy = strategy;
    }

    public static ResugarResult resugar(Expr e, MacroTable table, Strategy strategy) {
        if (e == null) throw new IllegalArgumentException("expr is null");
        if (table == null || table.isEmpty()) return new ResugarResult(e, false);

        Resugarer r = new Resugarer(table.list(), strategy == null ? Strategy.NORMAL : strategy);
        Expr out = e.accept(r);
        return r.changed ? new ResugarResult(out, true) : new ResugarResult(e, false);
    }

    private Expr.MacroRef match(Expr e) {
        for (MacroDefinition def : macros) {
            Expr value = def.resolve(strategy);
            if (AlphaEquivalence.equivalent(e, value)) {
                changed = true;
                return new Expr.MacroRef(def.name(), value);
            }
        }
        return null;
    }

    @Override
    public Expr visitVar(Expr.Var expr) {
        // a closed value never matches a lone variable
        return expr;
    }

    @Override
    public Expr visitAbs(Expr.Abs expr) {
        Expr.MacroRef m = match(expr);
        if (m != null) return m;
        Expr body = expr.body.accept(this);
        return body == expr.body ? expr : new Expr.Abs(expr.param, body);
    }

    @Override
    public Expr visitApp(Expr.App expr) {
        Expr.MacroRef m = match(expr);
        if (m != null) return m;
        Expr fn = expr.fn.accept(this);
        Expr arg = expr.arg.accept(this);
        return (fn == expr.fn && arg == expr.arg) ? expr : new Expr.App(fn, arg);
    }

    @Override
    public Expr visitMacroRef(Expr.MacroRef expr) {
        return expr;
    }
}
