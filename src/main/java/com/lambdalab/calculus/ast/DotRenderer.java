package com.lambdalab.calculus.ast;

/**
 * Graphviz rendering of an expression tree, for the front end's AST view.
 *
 * Application nodes are labelled {@code @}, abstractions {@code λx}, macro
 * references are boxes holding the macro name (their bodies are not expanded).
 */
public final class DotRenderer implements Expr.Visitor<String> {

    private final StringBuilder out = new StringBuilder();
    private int nextId = 0;

    private DotRenderer() {}

    public static String render(Expr e) {
        DotRenderer r = new DotRenderer();
        r.out.append("digraph ast {\n");
        e.accept(r);
        r.out.append("}\n");
        return r.out.toString();
    }

    private String node(String label, String shape) {
        String id = "n" + (nextId++);
        out.append("  ").append(id).append(" [label=\"").append(label).append('"');
        if (shape != null) out.append(", shape=").append(shape);
        out.append("];\n");
        return id;
    }

    private void edge(String from, String to, String label) {
        out.append("  ").append(from).append(" -> ").append(to);
        if (label != null) out.append(" [label=\"").append(label).append("\"]");
        out.append(";\n");
    }

    @Override
    public String visitVar(Expr.Var expr) {
        return node(expr.name, null);
    }

    @Override
    public String visitAbs(Expr.Abs expr) {
        String id = node(Printer.LAMBDA + expr.param, null);
        edge(id, expr.body.accept(this), null);
        return id;
    }

    @Override
    public String visitApp(Expr.App expr) {
        String id = node("@", null);
        edge(id, expr.fn.accept(this), "fn");
        edge(id, expr.arg.accept(this), "arg");
        return id;
    }

    @Override
    public String visitMacroRef(Expr.MacroRef expr) {
        return node(expr.name, "box");
    }
}
