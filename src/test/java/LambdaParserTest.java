import com.lambdalab.calculus.LambdaLab;
import com.lambdalab.calculus.ast.Expr;
import com.lambdalab.calculus.parser.ParseError;
import com.lambdalab.calculus.parser.Parser;
import com.lambdalab.calculus.parser.UnboundMacroError;
import com.lambdalab.calculus.reduce.Strategy;

import org.junit.jupiter.api.Test;

import static com.lambdalab.calculus.ast.Expr.abs;
import static com.lambdalab.calculus.ast.Expr.app;
import static com.lambdalab.calculus.ast.Expr.var;
import static org.junit.jupiter.api.Assertions.*;

public class LambdaParserTest {

    private static Expr parse(String code) {
        return Parser.parse(code, null, Strategy.NORMAL);
    }

    private static ParseError parseError(String code) {
        return assertThrows(ParseError.class, () -> parse(code));
    }

    @Test
    public void application_associatesLeft() {
        assertEquals(app(var("x"), var("y"), var("z")), parse("x y z"));
        assertEquals(app(var("x"), app(var("y"), var("z"))), parse("x (y z)"));
    }

    @Test
    public void abstractionBody_extendsAsFarAsPossible() {
        assertEquals(abs("x", app(var("x"), var("y"))), parse("\\x.x y"));
        assertEquals(abs("x", abs("y", var("x"))), parse("λx.λy.x"));
        assertEquals(app(abs("x", var("x")), var("y")), parse("(\\x.x) y"));
    }

    @Test
    public void whitespace_isInsignificant() {
        assertEquals(parse("(\\x.x x)(\\x.x x)"), parse("  ( \\ x . x   x ) ( \\x.x x )  "));
    }

    @Test
    public void syntaxErrors_reportMessageAndOffset() {
        ParseError e = parseError("");
        assertEquals("expected term", e.msg());
        assertEquals(0, e.pos());

        e = parseError("(x");
        assertEquals("unbalanced parentheses", e.msg());
        assertEquals(2, e.pos());

        e = parseError("\\.x");
        assertEquals("expected variable name after lambda", e.msg());
        assertEquals(1, e.pos());

        e = parseError("\\x x");
        assertEquals("expected dot after variable name", e.msg());
        assertEquals(3, e.pos());

        e = parseError("x )");
        assertEquals("unexpected token", e.msg());
        assertEquals(2, e.pos());

        e = parseError("x $");
        assertEquals("Unexpected character: $", e.msg());
        assertEquals(2, e.pos());
    }

    @Test
    public void uppercaseIdentifier_resolvesToMacroReference() {
        LambdaLab lab = new LambdaLab();
        assertTrue(lab.define("I", "\\x.x").isSuccess());

        Expr e = lab.parse("I x", Strategy.CBV);
        assertTrue(((Expr.App) e).fn instanceof Expr.MacroRef);
        Expr.MacroRef ref = (Expr.MacroRef) ((Expr.App) e).fn;
        assertEquals("I", ref.name);
        assertEquals(abs("x", var("x")), ref.resolved);
    }

    @Test
    public void undefinedMacro_isUnbound() {
        UnboundMacroError e = assertThrows(UnboundMacroError.class, () -> new LambdaLab().parse("x K", Strategy.CBV));
        assertEquals("K", e.name());
        assertEquals(2, e.pos());
    }
}
