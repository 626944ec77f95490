package com.lambdalab.calculus;

import java.util.List;

import com.lambdalab.calculus.ast.Expr;
import com.lambdalab.calculus.macro.DefinitionError;
import com.lambdalab.calculus.macro.DefinitionResult;
import com.lambdalab.calculus.macro.MacroCompiler;
import com.lambdalab.calculus.macro.MacroDefinition;
import com.lambdalab.calculus.macro.MacroTable;
import com.lambdalab.calculus.macro.ResugarResult;
import com.lambdalab.calculus.macro.Resugarer;
import com.lambdalab.calculus.parser.Lexer;
import com.lambdalab.calculus.parser.ParseError;
import com.lambdalab.calculus.parser.Parser;
import com.lambdalab.calculus.parser.UnboundMacroError;
import com.lambdalab.calculus.reduce.RunResult;
import com.lambdalab.calculus.reduce.Runner;
import com.lambdalab.calculus.reduce.Strategy;
import com.lambdalab.debug.Debug;

/**
 * One LambdaLab session.
 *
 * - Owns the session's {@link MacroTable} and passes it to every engine call
 * - Definitions: define(name, body) / defineSource("NAME = body")
 * - Evaluation: evaluate(code or expr, strategy) with a bounded step budget
 * - Resugaring of results into macro names
 *
 * Definition failures come back as {@link DefinitionResult} values. Timeouts
 * are {@link EvaluationResult#timedOut()}, never exceptions.
 */
public class LambdaLab {

    /** Reduction steps before a run is reported as a timeout. */
    public static final int DEFAULT_STEP_BUDGET = 100;

    private static final Debug.Channel LOG = Debug.channel("LambdaLab");

    private final MacroTable macros = new MacroTable();
    private int stepBudget = DEFAULT_STEP_BUDGET;
    private int macroBudget = DEFAULT_STEP_BUDGET;

    public MacroTable macros() { return macros; }

    public int getStepBudget() { return stepBudget; }

    /** Budget for evaluate(...) calls that do not pass one. */
    public void setStepBudget(int budget) {
        if (budget <= 0) throw new IllegalArgumentException("budget must be positive: " + budget);
        this.stepBudget = budget;
    }

    public int getMacroBudget() { return macroBudget; }

    /** Budget for each pre-evaluation run of a macro body. */
    public void setMacroBudget(int budget) {
        if (budget <= 0) throw new IllegalArgumentException("budget must be positive: " + budget);
        this.macroBudget = budget;
    }

    // ===================== PARSING =====================

    /** Parse {@code code}, resolving macro names for {@code strategy}. Throws {@link ParseError}. */
    public Expr parse(String code, Strategy strategy) {
        return Parser.parse(code, macros, strategy);
    }

    // ===================== MACROS =====================

    public DefinitionResult define(String name, Expr body) {
        return MacroCompiler.define(macros, name, body, macroBudget);
    }

    public DefinitionResult define(String name, String bodyCode) {
        Expr body;
        try {
            body = parse(bodyCode, Strategy.NORMAL);
        } catch (ParseError e) {
            return parseFailure(name, e);
        }
        return define(name, body);
    }

    /** Define from a line of the form {@code NAME = body} or {@code NAME ≜ body}. */
    public DefinitionResult defineSource(String source) {
        Parser.Definition def;
        try {
            def = new Parser(new Lexer(source).tokenize(), macros, Strategy.NORMAL).parseDefinition();
        } catch (ParseError e) {
            return parseFailure(null, e);
        }
        return define(def.name, def.body);
    }

    private DefinitionResult parseFailure(String name, ParseError e) {
        LOG.d("definition did not parse: " + e.getMessage());
        DefinitionError kind = (e instanceof UnboundMacroError) ? DefinitionError.UNBOUND_MACRO : DefinitionError.SYNTAX;
        return DefinitionResult.failure(name, kind, e.msg(), e.pos());
    }

    /** Definitions, dependencies before dependents. */
    public List<MacroDefinition> listMacros() {
        return macros.list();
    }

    public void clear() {
        macros.clear();
        LOG.i("macro table cleared");
    }

    // ===================== EVALUATION =====================

    public EvaluationResult evaluate(String code, Strategy strategy) {
        return evaluate(parse(code, strategy), strategy, stepBudget);
    }

    public EvaluationResult evaluate(Expr expr, Strategy strategy) {
        return evaluate(expr, strategy, stepBudget);
    }

    /**
     * Run {@code expr} for at most {@code budget} steps. Macro references are
     * re-resolved against the current table for {@code strategy} first.
     */
    public EvaluationResult evaluate(Expr expr, Strategy strategy, int budget) {
        if (expr == null) throw new IllegalArgumentException("expr is null");
        if (strategy == null) throw new IllegalArgumentException("strategy is null");

        Expr linked = MacroCompiler.relink(expr, macros.snapshot(), strategy);
        RunResult run = Runner.run(linked, budget, strategy);

        Expr resugared = null;
        if (!run.timedOut()) {
            ResugarResult r = Resugarer.resugar(run.finalExpr(), macros, strategy);
            if (r.changed()) resugared = r.expr();
        } else {
            LOG.i("no value within " + budget + " steps (" + strategy.label() + ")");
        }
        return new EvaluationResult(strategy, run, resugared);
    }

    public ResugarResult resugar(Expr expr, Strategy strategy) {
        return Resugarer.resugar(expr, macros, strategy);
    }
}
