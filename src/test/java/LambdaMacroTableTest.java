import com.lambdalab.calculus.EvaluationResult;
import com.lambdalab.calculus.LambdaLab;
import com.lambdalab.calculus.ast.Expr;
import com.lambdalab.calculus.ast.Printer;
import com.lambdalab.calculus.macro.DefinitionError;
import com.lambdalab.calculus.macro.DefinitionResult;
import com.lambdalab.calculus.macro.MacroCompiler;
import com.lambdalab.calculus.macro.MacroDefinition;
import com.lambdalab.calculus.macro.MacroTable;
import com.lambdalab.calculus.reduce.Strategy;
import com.lambdalab.debug.Debug;
import com.lambdalab.debug.DebugLevel;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class LambdaMacroTableTest {

    private LambdaLab lab;

    @BeforeEach
    void setUp() {
        lab = new LambdaLab();
        lab.setMacroBudget(30);
    }

    @AfterEach
    void resetDebug() {
        Debug.get().setSink(null);
    }

    private static String render(Expr e) {
        return e == null ? null : Printer.render(e);
    }

    private List<String> listedNames() {
        List<String> out = new ArrayList<>();
        for (MacroDefinition d : lab.listMacros()) out.add(d.name());
        return out;
    }

    @Test
    public void normalizingBody_storesOnlyFullNormalForm() {
        DefinitionResult r = lab.define("I", "\\x.x");

        assertTrue(r.isSuccess(), r.toString());
        MacroDefinition def = lab.macros().get("I");
        assertEquals("λx.x", render(def.fullNormalForm()));
        assertNull(def.cbvValue());
        assertNull(def.cbnValue());
        assertEquals(Arrays.asList("λx.x"), r.trace().steps());
        assertEquals("I ≜ λx.x", def.render());
    }

    @Test
    public void definitionTrace_showsNormalOrderReduction() {
        lab.define("I", "\\x.x");
        lab.define("K", "\\x.\\y.x");

        DefinitionResult r = lab.define("KI", "K I");
        assertTrue(r.isSuccess(), r.toString());
        assertEquals(Arrays.asList("K I", "λy.I", "λy.λx.x"), r.trace().steps());
        assertEquals("λy.λx.x", render(r.definition().fullNormalForm()));
        assertEquals("KI ≜ K I", r.definition().render());
    }

    @Test
    public void weakValueWithoutNormalForm_storesBothWeakSlots() {
        DefinitionResult r = lab.define("LOOPY", "\\x.(\\y.y y)(\\y.y y)");

        assertTrue(r.isSuccess(), r.toString());
        MacroDefinition def = r.definition();
        assertNull(def.fullNormalForm());
        assertEquals("λx.(λy.y y)(λy.y y)", render(def.cbvValue()));
        assertEquals("λx.(λy.y y)(λy.y y)", render(def.cbnValue()));
        assertTrue(def.hasValue());
    }

    @Test
    public void onlyCallByNameConverges_resolutionFallsBackPerStrategyFamily() {
        DefinitionResult r = lab.define("LAZY", "(\\x.\\y.(\\z.z z)(\\z.z z)) ((\\x.x x)(\\x.x x))");

        assertTrue(r.isSuccess(), r.toString());
        MacroDefinition def = r.definition();
        assertNull(def.fullNormalForm());
        assertNull(def.cbvValue());
        assertEquals("λy.(λz.z z)(λz.z z)", render(def.cbnValue()));

        assertSame(def.cbnValue(), def.resolve(Strategy.CBN));
        assertSame(def.cbnValue(), def.resolve(Strategy.NORMAL));
        assertSame(def.unreducedBody(), def.resolve(Strategy.CBV));
        assertSame(def.unreducedBody(), def.resolve(Strategy.APPLICATIVE));
    }

    @Test
    public void divergentBody_keepsOnlyUnreducedBody() {
        DefinitionResult r = lab.define("OMEGA", "(\\x.x x)(\\x.x x)");

        assertTrue(r.isSuccess(), r.toString());
        MacroDefinition def = r.definition();
        assertFalse(def.hasValue());
        for (Strategy s : Strategy.values()) assertSame(def.unreducedBody(), def.resolve(s));
        assertEquals(30, r.trace().size());
    }

    @Test
    public void freeVariable_isRejectedAndTableUnchanged() {
        lab.define("I", "\\x.x");
        Map<String, MacroDefinition> before = lab.macros().snapshot();

        DefinitionResult r = lab.define("BAD", "\\x.y");
        assertFalse(r.isSuccess());
        assertEquals(DefinitionError.NON_CLOSED, r.error());
        assertTrue(r.message().contains("[y]"), r.message());
        assertSame(before, lab.macros().snapshot());
    }

    @Test
    public void closedness_treatsMacroReferencesAsClosed() {
        assertTrue(MacroCompiler.isClosed(Expr.abs("x", Expr.app(Expr.var("x"), Expr.macro("I", Expr.var("q"))))));
        assertFalse(MacroCompiler.isClosed(Expr.abs("x", Expr.var("y"))));
        assertFalse(MacroCompiler.isClosed(Expr.app(Expr.abs("x", Expr.var("x")), Expr.var("x"))));
    }

    @Test
    public void invalidName_isRejected() {
        assertEquals(DefinitionError.INVALID_NAME, lab.define("lower", "\\x.x").error());
        assertEquals(DefinitionError.INVALID_NAME, lab.define("", "\\x.x").error());
        assertTrue(lab.macros().isEmpty());
    }

    @Test
    public void mixedCaseName_isStoredUppercase() {
        assertTrue(lab.define("Id", "\\x.x").isSuccess());
        assertEquals("ID", lab.macros().get("id").name());
        assertTrue(lab.macros().contains("ID"));
    }

    @Test
    public void undefinedReference_isUnbound() {
        DefinitionResult r = lab.define("A", "B");
        assertEquals(DefinitionError.UNBOUND_MACRO, r.error());
        assertEquals(0, r.pos());

        // same check when the body is built directly rather than parsed
        r = lab.define("A", Expr.macro("B", Expr.abs("x", Expr.var("x"))));
        assertEquals(DefinitionError.UNBOUND_MACRO, r.error());
        assertTrue(lab.macros().isEmpty());
    }

    @Test
    public void mutualDefinition_isRejectedAsCycleAndTableRollsBack() {
        assertTrue(lab.define("B", "\\x.x").isSuccess());
        assertTrue(lab.define("A", "B").isSuccess());
        Map<String, MacroDefinition> afterFirst = lab.macros().snapshot();

        DefinitionResult r = lab.define("B", "A");

        assertEquals(DefinitionError.CYCLIC, r.error());
        assertEquals("Cannot define circularly dependent macro: B -> A -> B", r.message());
        assertSame(afterFirst, lab.macros().snapshot());
        assertEquals("λx.x", render(lab.macros().get("B").unreducedBody()));
    }

    @Test
    public void mutualDefinition_withoutPredefinedTarget_neverHoldsBothEdges() {
        assertEquals(DefinitionError.UNBOUND_MACRO, lab.define("A", "B").error());
        assertEquals(DefinitionError.UNBOUND_MACRO, lab.define("B", "A").error());
        assertTrue(lab.macros().isEmpty());
    }

    @Test
    public void selfReference_isACycle() {
        lab.define("F", "\\x.x");
        DefinitionResult r = lab.define("F", "\\x.F x");
        assertEquals(DefinitionError.CYCLIC, r.error());
        assertEquals("λx.x", render(lab.macros().get("F").unreducedBody()));
    }

    @Test
    public void cycleRejection_isLogged() {
        List<String> warnings = new ArrayList<>();
        Debug.get().setSink((level, tag, message, error) -> {
            if (level == DebugLevel.WARN) warnings.add(tag + ": " + message);
        });

        lab.define("B", "\\x.x");
        lab.define("A", "B");
        lab.define("B", "A");

        assertEquals(1, warnings.size());
        assertTrue(warnings.get(0).startsWith("Macros: rejected B"), warnings.get(0));
    }

    @Test
    public void redefinition_recompilesDependents() {
        lab.define("T", "\\x.\\y.x");
        lab.define("U", "T");
        assertEquals("λx.λy.x", render(lab.macros().get("U").fullNormalForm()));

        assertTrue(lab.define("T", "\\x.\\y.y").isSuccess());
        assertEquals("λx.λy.y", render(lab.macros().get("U").fullNormalForm()));
        assertEquals("λx.λy.y", render(lab.parse("U", Strategy.CBV).accept(new ResolvedBody())));
    }

    @Test
    public void listing_ordersDependenciesFirst() {
        lab.define("I", "\\x.x");
        lab.define("K", "\\x.\\y.x");
        lab.define("KI", "K I");
        lab.define("Z", "\\z.z");
        assertTrue(lab.define("K", "\\a.Z").isSuccess());

        assertEquals(Arrays.asList("I", "Z", "K", "KI"), listedNames());
        assertEquals("λz.z", render(lab.macros().get("KI").fullNormalForm()));
    }

    @Test
    public void definitionLine_acceptsBothDefinitionSigns() {
        assertTrue(lab.defineSource("I = \\x.x").isSuccess());
        assertTrue(lab.defineSource("K ≜ λx.λy.x").isSuccess());
        assertEquals(Arrays.asList("I", "K"), listedNames());

        DefinitionResult r = lab.defineSource("= \\x.x");
        assertEquals(DefinitionError.SYNTAX, r.error());
        assertEquals("expected macro name", r.message());
    }

    @Test
    public void clear_emptiesTable() {
        lab.define("I", "\\x.x");
        lab.clear();
        assertTrue(lab.macros().isEmpty());
        assertTrue(lab.listMacros().isEmpty());
    }

    @Test
    public void tableReference_isResolvedForStrategy() {
        lab.define("LAZY", "(\\x.\\y.(\\z.z z)(\\z.z z)) ((\\x.x x)(\\x.x x))");
        MacroTable table = lab.macros();

        assertEquals("λy.(λz.z z)(λz.z z)", render(table.reference("LAZY", Strategy.CBN).resolved));
        assertSame(table.get("LAZY").unreducedBody(), table.reference("LAZY", Strategy.CBV).resolved);
        assertNull(table.reference("NOPE", Strategy.CBV));
    }

    @Test
    public void nestedReferences_followTheActiveStrategy() {
        assertTrue(lab.define("LAZY", "(\\x.\\y.(\\z.z z)(\\z.z z)) ((\\x.x x)(\\x.x x))").isSuccess());
        assertTrue(lab.define("M", "(\\x.x) LAZY").isSuccess());
        assertTrue(lab.define("N", "M").isSuccess());

        assertTrue(lab.evaluate("(\\x.x) LAZY", Strategy.CBV).timedOut());
        assertTrue(lab.evaluate("M", Strategy.CBV).timedOut());
        assertTrue(lab.evaluate("N", Strategy.CBV).timedOut());

        MacroDefinition m = lab.macros().get("M");
        MacroDefinition n = lab.macros().get("N");
        assertNull(m.cbvValue());
        assertNull(n.cbvValue());
        assertNull(n.fullNormalForm());
        assertEquals("λy.(λz.z z)(λz.z z)", render(m.cbnValue()));
        assertEquals("λy.(λz.z z)(λz.z z)", render(n.cbnValue()));

        EvaluationResult lazy = lab.evaluate("M", Strategy.CBN);
        assertFalse(lazy.timedOut());
        assertEquals("λy.(λz.z z)(λz.z z)", render(lazy.finalExpr()));
    }

    /** Unwraps a top-level macro reference. */
    private static final class ResolvedBody implements Expr.Visitor<Expr> {
        @Override public Expr visitVar(Expr.Var expr) { return expr; }
        @Override public Expr visitAbs(Expr.Abs expr) { return expr; }
        @Override public Expr visitApp(Expr.App expr) { return expr; }
        @Override public Expr visitMacroRef(Expr.MacroRef expr) { return expr.resolved; }
    }
}
