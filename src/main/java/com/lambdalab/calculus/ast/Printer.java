package com.lambdalab.calculus.ast;

/**
 * Renders expressions as text.
 *
 * Layout rules:
 *  - application is left associative: {@code f a b} is {@code (f a) b}
 *  - an abstraction in function position is parenthesised
 *  - an application or abstraction in argument position is parenthesised and
 *    follows the function without a space: {@code (λx.x x)(λx.x x)}
 *  - any other argument follows after one space: {@code (λx.x) y}
 *  - abstraction bodies extend as far right as possible
 *
 * With a redex path, the function side of that redex is wrapped in
 * {@code <a>..</a>} and its argument in {@code <s>..</s>}. When the path
 * points at a MacroRef (an unfolding step) the name is wrapped in
 * {@code <a>..</a>}.
 */
public final class Printer implements Expr.Visitor<Void> {

    public static final String LAMBDA = "λ";

    public static final String ACTIVE_OPEN = "<a>";
    public static final String ACTIVE_CLOSE = "</a>";
    public static final String SUBST_OPEN = "<s>";
    public static final String SUBST_CLOSE = "</s>";

    private final StringBuilder out = new StringBuilder();

    // Remaining path to the highlighted node, relative to the node being
    // printed; null when the current node is off the path.
    private RedexPath target;

    private Printer(RedexPath target) {
        this.target = target;
    }

    public static String render(Expr e) {
        return render(e, null);
    }

    public static String render(Expr e, RedexPath highlight) {
        Printer p = new Printer(highlight);
        e.accept(p);
        return p.out.toString();
    }

    /** Drop highlight markers from a rendered string. */
    public static String stripMarkers(String rendered) {
        return rendered
                .replace(ACTIVE_OPEN, "").replace(ACTIVE_CLOSE, "")
                .replace(SUBST_OPEN, "").replace(SUBST_CLOSE, "");
    }

    @Override
    public Void visitVar(Expr.Var expr) {
        if (atTarget()) {
            out.append(ACTIVE_OPEN).append(expr.name).append(ACTIVE_CLOSE);
        } else {
            out.append(expr.name);
        }
        return null;
    }

    @Override
    public Void visitAbs(Expr.Abs expr) {
        if (atTarget()) {
            out.append(ACTIVE_OPEN).append(Printer.render(expr)).append(ACTIVE_CLOSE);
            return null;
        }
        out.append(LAMBDA).append(expr.param).append('.');
        child(expr.body, RedexPath.Direction.BODY);
        return null;
    }

    @Override
    public Void visitApp(Expr.App expr) {
        boolean active = atTarget();
        RedexPath saved = target;

        boolean fnParen = expr.fn instanceof Expr.Abs;
        boolean argParen = expr.arg instanceof Expr.App || expr.arg instanceof Expr.Abs;

        if (fnParen) out.append('(');
        if (active) {
            out.append(ACTIVE_OPEN).append(Printer.render(expr.fn)).append(ACTIVE_CLOSE);
        } else {
            child(expr.fn, RedexPath.Direction.FN);
        }
        if (fnParen) out.append(')');

        out.append(argParen ? "(" : " ");
        if (active) {
            out.append(SUBST_OPEN).append(Printer.render(expr.arg)).append(SUBST_CLOSE);
        } else {
            target = saved;
            child(expr.arg, RedexPath.Direction.ARG);
        }
        if (argParen) out.append(')');

        target = saved;
        return null;
    }

    @Override
    public Void visitMacroRef(Expr.MacroRef expr) {
        if (atTarget()) {
            out.append(ACTIVE_OPEN).append(expr.name).append(ACTIVE_CLOSE);
        } else {
            out.append(expr.name);
        }
        return null;
    }

    private boolean atTarget() {
        return target != null && target.isRoot();
    }

    private void child(Expr e, RedexPath.Direction dir) {
        RedexPath saved = target;
        target = (saved != null && !saved.isRoot() && saved.head() == dir) ? saved.tail() : null;
        e.accept(this);
        target = saved;
    }
}
