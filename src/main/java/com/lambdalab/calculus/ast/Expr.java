package com.lambdalab.calculus.ast;

import java.util.Objects;

/**
 * Lambda-calculus expression tree.
 *
 * The variant is closed: the only subclasses are the four nested node types
 * below (the constructor is private), and every operation over a tree is a
 * {@link Visitor}, so a new node type cannot be added without every visitor
 * handling it.
 *
 * Nodes are immutable. Reduction and substitution build new trees and keep
 * unchanged subtrees shared.
 */
public abstract class Expr {

    public interface Visitor<R> {
        R visitVar(Var expr);
        R visitAbs(Abs expr);
        R visitApp(App expr);
        R visitMacroRef(MacroRef expr);
    }

    private Expr() {}

    public abstract <R> R accept(Visitor<R> visitor);

    @Override
    public String toString() {
        return Printer.render(this);
    }

    // -------------------------
    // Factories
    // -------------------------

    public static Var var(String name) { return new Var(name); }

    public static Abs abs(String param, Expr body) { return new Abs(param, body); }

    /** Left-associative application: app(f, a, b) == ((f a) b). */
    public static Expr app(Expr fn, Expr... args) {
        Expr out = fn;
        for (Expr a : args) out = new App(out, a);
        return out;
    }

    public static MacroRef macro(String name, Expr resolved) { return new MacroRef(name, resolved); }

    // -------------------------
    // Nodes
    // -------------------------

    public static final class Var extends Expr {
        public final String name;

        public Var(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitVar(this);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Var && ((Var) o).name.equals(name);
        }

        @Override
        public int hashCode() {
            return name.hashCode();
        }
    }

    public static final class Abs extends Expr {
        public final String param;
        public final Expr body;

        public Abs(String param, Expr body) {
            this.param = Objects.requireNonNull(param, "param");
            this.body = Objects.requireNonNull(body, "body");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAbs(this);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Abs)) return false;
            Abs other = (Abs) o;
            return param.equals(other.param) && body.equals(other.body);
        }

        @Override
        public int hashCode() {
            return 31 * param.hashCode() + body.hashCode();
        }
    }

    public static final class App extends Expr {
        public final Expr fn;
        public final Expr arg;

        public App(Expr fn, Expr arg) {
            this.fn = Objects.requireNonNull(fn, "fn");
            this.arg = Objects.requireNonNull(arg, "arg");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitApp(this);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof App)) return false;
            App other = (App) o;
            return fn.equals(other.fn) && arg.equals(other.arg);
        }

        @Override
        public int hashCode() {
            return 31 * fn.hashCode() + arg.hashCode() + 7;
        }
    }

    /**
     * Reference to a named macro. {@code resolved} is the body chosen for the
     * active strategy when the reference was made; the node prints as its
     * name until a reduction unfolds it.
     */
    public static final class MacroRef extends Expr {
        public final String name;
        public final Expr resolved;

        public MacroRef(String name, Expr resolved) {
            this.name = Objects.requireNonNull(name, "name");
            this.resolved = Objects.requireNonNull(resolved, "resolved");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitMacroRef(this);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof MacroRef)) return false;
            MacroRef other = (MacroRef) o;
            return name.equals(other.name) && resolved.equals(other.resolved);
        }

        @Override
        public int hashCode() {
            return 31 * name.hashCode() + resolved.hashCode() + 13;
        }
    }
}
