package com.lambdalab.calculus.reduce;

import com.lambdalab.calculus.ast.Expr;
import com.lambdalab.calculus.ast.Printer;
import com.lambdalab.debug.Debug;

/**
 * Bounded driver: records a snapshot, then steps, at most {@code budget}
 * times. The budget is the only way a non-terminating reduction is stopped.
 */
public final class Runner {

    private static final Debug.Channel LOG = Debug.channel("Runner");

    private Runner() {}

    public static RunResult run(Expr initial, int budget, Reducer reducer) {
        if (initial == null) throw new IllegalArgumentException("initial is null");
        if (reducer == null) throw new IllegalArgumentException("reducer is null");
        if (budget <= 0) throw new IllegalArgumentException("budget must be positive: " + budget);

        Trace trace = new Trace();
        Expr current = initial;
        for (int i = 0; i < budget; i++) {
            Step step = reducer.step(current);
            trace.add(new TraceEntry(current, step == null ? null : step.redex));
            if (step == null) {
                LOG.t("value after " + i + " step(s)");
                return new RunResult(trace, current);
            }
            Expr next = step.result;
            LOG.t(() -> step.redex + " -> " + Printer.render(next));
            current = next;
        }

        LOG.d("timeout after " + budget + " step(s)");
        return new RunResult(trace, null);
    }

    public static RunResult run(Expr initial, int budget, Strategy strategy) {
        return run(initial, budget, strategy.reducer());
    }
}
