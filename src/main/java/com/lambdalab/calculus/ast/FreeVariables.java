package com.lambdalab.calculus.ast;

import java.util.LinkedHashSet;
import java.util.Set;

/** Name queries over expressions. MacroRefs are closed and contribute no names. */
public final class FreeVariables {

    private FreeVariables() {}

    /** Free variables of {@code e}, in first-occurrence order. */
    public static Set<String> of(Expr e) {
        Set<String> out = new LinkedHashSet<>();
        e.accept(new Collector(out, false));
        return out;
    }

    /** Every variable name in {@code e}, free or bound (binders included). */
    public static Set<String> allNames(Expr e) {
        Set<String> out = new LinkedHashSet<>();
        e.accept(new Collector(out, true));
        return out;
    }

    public static boolean occursFree(String name, Expr e) {
        return e.accept(new Expr.Visitor<Boolean>() {
            @Override public Boolean visitVar(Expr.Var expr) { return expr.name.equals(name); }
            @Override public Boolean visitAbs(Expr.Abs expr) { return !expr.param.equals(name) && expr.body.accept(this); }
            @Override public Boolean visitApp(Expr.App expr) { return expr.fn.accept(this) || expr.arg.accept(this); }
            @Override public Boolean visitMacroRef(Expr.MacroRef expr) { return false; }
        });
    }

    private static final class Collector implements Expr.Visitor<Void> {
        private final Set<String> out;
        private final boolean includeBound;
        private final Set<String> bound = new LinkedHashSet<>();

        Collector(Set<String> out, boolean includeBound) {
            this.out = out;
            this.includeBound = includeBound;
        }

        @Override
        public Void visitVar(Expr.Var expr) {
            if (includeBound || !bound.contains(expr.name)) out.add(expr.name);
            return null;
        }

        @Override
        public Void visitAbs(Expr.Abs expr) {
            if (includeBound) out.add(expr.param);
            boolean added = bound.add(expr.param);
            expr.body.accept(this);
            if (added) bound.remove(expr.param);
            return null;
        }

        @Override
        public Void visitApp(Expr.App expr) {
            expr.fn.accept(this);
            expr.arg.accept(this);
            return null;
        }

        @Override
        public Void visitMacroRef(Expr.MacroRef expr) {
            return null;
        }
    }
}
