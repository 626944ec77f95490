package com.lambdalab.calculus.macro;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.lambdalab.calculus.ast.Expr;
import com.lambdalab.calculus.ast.FreeVariables;
import com.lambdalab.calculus.reduce.RunResult;
import com.lambdalab.calculus.reduce.Runner;
import com.lambdalab.calculus.reduce.Strategy;
import com.lambdalab.calculus.reduce.Trace;
import com.lambdalab.debug.Debug;

/**
 * Macro definition and pre-evaluation.
 *
 * A definition is transactional: it is checked, added to a copy of the table,
 * the copy is ordered and every macro in it recompiled, and only then is the
 * copy published. Any failure leaves the table as it was.
 */
public final class MacroCompiler {

    private static final Debug.Channel LOG = Debug.channel("Macros");

    private MacroCompiler() {}

    /** A compiled definition and the trace of the run that produced its value. */
    static final class Compiled {
        final MacroDefinition definition;
        final Trace trace;

        Compiled(MacroDefinition definition, Trace trace) {
            this.definition = definition;
            this.trace = trace;
        }
    }

    public static DefinitionResult define(MacroTable table, String name, Expr body, int budget) {
        if (table == null) throw new IllegalArgumentException("table is null");
        if (body == null) throw new IllegalArgumentException("body is null");
        if (budget <= 0) throw new IllegalArgumentException("budget must be positive: " + budget);

        if (!MacroTable.isValidName(name)) {
            return DefinitionResult.failure(name, DefinitionError.INVALID_NAME,
                    "Macro names must start with an uppercase letter: " + name);
        }
        String key = MacroTable.normalize(name);

        if (!isClosed(body)) {
            Set<String> free = FreeVariables.of(body);
            return DefinitionResult.failure(key, DefinitionError.NON_CLOSED,
                    "Macro " + key + " has free variable(s) " + free);
        }

        Map<String, MacroDefinition> candidate = new LinkedHashMap<>(table.snapshot());
        for (String dep : MacroDefinition.uncompiled(key, body).dependencies()) {
            if (!candidate.containsKey(dep)) {
                return DefinitionResult.failure(key, DefinitionError.UNBOUND_MACRO,
                        "Macro " + key + " refers to undefined macro " + dep);
            }
        }
        candidate.put(key, MacroDefinition.uncompiled(key, body));

        DependencyGraph.Order order = DependencyGraph.sort(candidate);
        if (order.hasCycle()) {
            LOG.w("rejected " + key + ": cycle " + order.cycle());
            return DefinitionResult.failure(key, DefinitionError.CYCLIC,
                    "Cannot define circularly dependent macro: " + String.join(" -> ", order.cycle()));
        }

        Trace trace = recompile(candidate, order.order(), key, budget);
        table.publish(candidate);

        MacroDefinition stored = candidate.get(key);
        LOG.i("defined " + stored.render()
                + (stored.hasValue() ? "" : " (no value within " + budget + " steps)"));
        return DefinitionResult.success(stored, trace);
    }

    /**
     * Recompile every macro of {@code macros} in {@code order}, in place.
     * Returns the trace of {@code traced}, or null if it is not in the order.
     */
    static Trace recompile(Map<String, MacroDefinition> macros, List<String> order, String traced, int budget) {
        Trace out = null;
        for (String n : order) {
            Compiled c = compile(n, macros.get(n).unreducedBody(), macros, budget);
            macros.put(n, c.definition);
            if (n.equals(traced)) out = c.trace;
        }
        LOG.d("recompiled " + order.size() + " macro(s)");
        return out;
    }

    /**
     * Pre-evaluate a body: normal order first; if that times out, call-by-name
     * and call-by-value independently. References inside the body are
     * relinked against {@code scope} for each run.
     */
    static Compiled compile(String name, Expr body, Map<String, MacroDefinition> scope, int budget) {
        Expr unreduced = relink(body, scope, Strategy.NORMAL);

        RunResult normal = Runner.run(unreduced, budget, Strategy.NORMAL);
        if (!normal.timedOut()) {
            return new Compiled(new MacroDefinition(name, unreduced, null, null, normal.finalExpr()), normal.trace());
        }

        RunResult cbn = Runner.run(relink(body, scope, Strategy.CBN), budget, Strategy.CBN);
        RunResult cbv = Runner.run(relink(body, scope, Strategy.CBV), budget, Strategy.CBV);

        Expr cbnValue = cbn.finalExpr();
        Expr cbvValue = cbv.finalExpr();
        if (cbnValue == null && cbvValue == null) {
            LOG.d(() -> name + " has no value under any strategy");
        }

        Trace trace = (cbnValue != null) ? cbn.trace() : (cbvValue != null) ? cbv.trace() : normal.trace();
        return new Compiled(new MacroDefinition(name, unreduced, cbvValue, cbnValue, null), trace);
    }

    /**
     * Re-resolve every macro reference in {@code e} against {@code scope}.
     * The bodies references resolve to are relinked as well, so nested
     * references follow {@code strategy} too.
     */
    public static Expr relink(Expr e, Map<String, MacroDefinition> scope, Strategy strategy) {
        return e.accept(new Linker(scope, strategy));
    }

    private static final class Linker implements Expr.Visitor<Expr> {
        private final Map<String, MacroDefinition> scope;
        private final Strategy strategy;
        private final Map<String, Expr> linked = new HashMap<>();

        Linker(Map<String, MacroDefinition> scope, Strategy strategy) {
            this.scope = scope;
            this.strategy = strategy;
        }

        @Override
        public Expr visitVar(Expr.Var expr) {
            return expr;
        }

        @Override
        public Expr visitAbs(Expr.Abs expr) {
            Expr body = expr.body.accept(this);
            return body == expr.body ? expr : new Expr.Abs(expr.param, body);
        }

        @Override
        public Expr visitApp(Expr.App expr) {
            Expr fn = expr.fn.accept(this);
            Expr arg = expr.arg.accept(this);
            return (fn == expr.fn && arg == expr.arg) ? expr : new Expr.App(fn, arg);
        }

        @Override
        public Expr visitMacroRef(Expr.MacroRef expr) {
            MacroDefinition def = scope.get(expr.name);
            if (def == null) return expr;
            Expr resolved = linked.get(expr.name);
            if (resolved == null) {
                // terminates: published tables are acyclic
                resolved = def.resolve(strategy).accept(this);
                linked.put(expr.name, resolved);
            }
            return resolved == expr.resolved ? expr : new Expr.MacroRef(expr.name, resolved);
        }
    }

    /** True when every variable is bound by an enclosing abstraction. Macro references count as closed. */
    public static boolean isClosed(Expr e) {
        Deque<String> binders = new ArrayDeque<>();
        return e.accept(new Expr.Visitor<Boolean>() {
            @Override
            public Boolean visitVar(Expr.Var expr) {
                return binders.contains(expr.name);
            }

            @Override
            public Boolean visitAbs(Expr.Abs expr) {
                binders.push(expr.param);
                try {
                    return expr.body.accept(this);
                } finally {
                    binders.pop();
                }
            }

            @Override
            public Boolean visitApp(Expr.App expr) {
                return expr.fn.accept(this) && expr.arg.accept(this);
            }

            @Override
            public Boolean visitMacroRef(Expr.MacroRef expr) {
                return true;
            }
        });
    }
}
