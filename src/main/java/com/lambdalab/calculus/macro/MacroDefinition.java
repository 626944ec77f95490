package com.lambdalab.calculus.macro;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import com.lambdalab.calculus.ast.Expr;
import com.lambdalab.calculus.ast.Printer;
import com.lambdalab.calculus.reduce.Strategy;

/**
 * A named closed term and its pre-computed values.
 *
 * At most one family of slots is filled: either {@code fullNormalForm}
 * (valid under every strategy) or any of the weak values {@code cbvValue}
 * and {@code cbnValue}. All slots are null when nothing converged within the
 * budget.
 */
public final class MacroDefinition {

    public static final String DEFINES = "≜";

    private final String name;
    private final Expr unreducedBody;
    private final Expr cbvValue;
    private final Expr cbnValue;
    private final Expr fullNormalForm;

    MacroDefinition(String name, Expr unreducedBody, Expr cbvValue, Expr cbnValue, Expr fullNormalForm) {
        this.name = name;
        this.unreducedBody = unreducedBody;
        this.cbvValue = cbvValue;
        this.cbnValue = cbnValue;
        this.fullNormalForm = fullNormalForm;
    }

    /** Not yet compiled: only the body. */
    static MacroDefinition uncompiled(String name, Expr body) {
        return new MacroDefinition(name, body, null, null, null);
    }

    public String name() { return name; }
    public Expr unreducedBody() { return unreducedBody; }
    public Expr cbvValue() { return cbvValue; }
    public Expr cbnValue() { return cbnValue; }
    public Expr fullNormalForm() { return fullNormalForm; }

    /**
     * What a reference to this macro stands for under {@code strategy}:
     * the normal form if known, else the weak value of the strategy's family
     * (strict strategies use the call-by-value slot, lazy ones the
     * call-by-name slot), else the literal body.
     */
    public Expr resolve(Strategy strategy) {
        if (fullNormalForm != null) return fullNormalForm;
        Expr weak = strategy.isStrict() ? cbvValue : cbnValue;
        return (weak != null) ? weak : unreducedBody;
    }

    /** True when some strategy reduced the body to a value within the budget. */
    public boolean hasValue() {
        return fullNormalForm != null || cbvValue != null || cbnValue != null;
    }

    /** Names of the macros the unreduced body refers to directly. */
    public Set<String> dependencies() {
        Set<String> out = new LinkedHashSet<>();
        unreducedBody.accept(new Expr.Visitor<Void>() {
            @Override public Void visitVar(Expr.Var expr) { return null; }
            @Override public Void visitAbs(Expr.Abs expr) { return expr.body.accept(this); }
            @Override public Void visitApp(Expr.App expr) {
                expr.fn.accept(this);
                return expr.arg.accept(this);
            }
            @Override public Void visitMacroRef(Expr.MacroRef expr) {
                out.add(expr.name);
                return null;
            }
        });
        return Collections.unmodifiableSet(out);
    }

    /** Listing line, e.g. {@code K ≜ λx.λy.x}. */
    public String render() {
        return name + " " + DEFINES + " " + Printer.render(unreducedBody);
    }

    @Override
    public String toString() {
        return render();
    }
}
