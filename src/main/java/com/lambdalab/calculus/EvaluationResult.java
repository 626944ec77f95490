package com.lambdalab.calculus;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.lambdalab.calculus.ast.Expr;
import com.lambdalab.calculus.ast.Printer;
import com.lambdalab.calculus.reduce.RunResult;
import com.lambdalab.calculus.reduce.Strategy;
import com.lambdalab.calculus.reduce.Trace;

/** A run plus, when a value was reached, its resugared form. */
public final class EvaluationResult {

    /** Prefix of the extra display line for a resugared result. */
    public static final String RESUGARED_PREFIX = "=   ";

    private final Strategy strategy;
    private final RunResult run;
    private final Expr resugared;

    EvaluationResult(Strategy strategy, RunResult run, Expr resugared) {
        this.strategy = strategy;
        this.run = run;
        this.resugared = resugared;
    }

    public Strategy strategy() { return strategy; }

    public Trace trace() { return run.trace(); }

    /** Null on timeout. */
    public Expr finalExpr() { return run.finalExpr(); }

    public boolean timedOut() { return run.timedOut(); }

    public int stepsTaken() { return run.stepsTaken(); }

    /** The value folded into macro names; null on timeout or when nothing matched. */
    public Expr resugared() { return resugared; }

    /**
     * Lines to show: every snapshot with the active redex marked, then the
     * resugared value (if any) as {@code =   NAME}.
     */
    public List<String> displayLines() {
        List<String> out = new ArrayList<>(run.trace().highlightedSteps());
        if (resugared != null) out.add(RESUGARED_PREFIX + Printer.render(resugared));
        return Collections.unmodifiableList(out);
    }
}
