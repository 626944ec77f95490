package com.lambdalab.calculus.ast;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Capture-avoiding substitution {@code body[name := value]}.
 *
 * Binders that would capture a free variable of {@code value} are renamed to
 * a fresh name first. Subtrees where {@code name} is not free come back as
 * the same instance.
 */
public final class Substitution {

    private Substitution() {}

    public static Expr substitute(Expr body, String name, Expr value) {
        if (body == null) throw new IllegalArgumentException("body is null");
        if (name == null) throw new IllegalArgumentException("name is null");
        if (value == null) throw new IllegalArgumentException("value is null");
        return body.accept(new Substituter(name, value));
    }

    /**
     * {@code base} with the smallest positive numeric suffix that is not in
     * {@code used}. Trailing digits of {@code base} are replaced, so renaming
     * {@code y1} gives {@code y2}, not {@code y11}.
     */
    public static String freshName(String base, Set<String> used) {
        String stem = base;
        int end = stem.length();
        while (end > 0 && Character.isDigit(stem.charAt(end - 1))) end--;
        if (end > 0) stem = stem.substring(0, end);

        for (int i = 1; ; i++) {
            String candidate = stem + i;
            if (!used.contains(candidate)) return candidate;
        }
    }

    private static final class Substituter implements Expr.Visitor<Expr> {
        private final String name;
        private final Expr value;
        private Set<String> valueFree;

        Substituter(String name, Expr value) {
            this.name = name;
            this.value = value;
        }

        private Set<String> valueFree() {
            if (valueFree == null) valueFree = FreeVariables.of(value);
            return valueFree;
        }

        @Override
        public Expr visitVar(Expr.Var expr) {
            return expr.name.equals(name) ? value : expr;
        }

        @Override
        public Expr visitAbs(Expr.Abs expr) {
            if (expr.param.equals(name)) return expr;
            if (!FreeVariables.occursFree(name, expr.body)) return expr;

            if (valueFree().contains(expr.param)) {
                Set<String> used = new LinkedHashSet<>(FreeVariables.allNames(expr.body));
                used.addAll(FreeVariables.allNames(value));
                used.add(name);
                String fresh = freshName(expr.param, used);

                // fresh is unused in the body, so this rename cannot capture.
                Expr renamed = substitute(expr.body, expr.param, new Expr.Var(fresh));
                return new Expr.Abs(fresh, renamed.accept(this));
            }

            Expr body = expr.body.accept(this);
            return body == expr.body ? expr : new Expr.Abs(expr.param, body);
        }

        @Override
        public Expr visitApp(Expr.App expr) {
            Expr fn = expr.fn.accept(this);
            Expr arg = expr.arg.accept(this);
            if (fn == expr.fn && arg == expr.arg) return expr;
            return new Expr.App(fn, arg);
        }

        @Override
        public Expr visitMacroRef(Expr.MacroRef expr) {
            // macro bodies are closed
            return expr;
        }
    }
}
