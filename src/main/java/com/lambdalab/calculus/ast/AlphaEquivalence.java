package com.lambdalab.calculus.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Equality up to renaming of bound variables.
 *
 * Two MacroRefs with the same name are equal. A MacroRef against any other
 * node is compared through its resolved expression.
 */
public final class AlphaEquivalence {

    private AlphaEquivalence() {}

    public static boolean equivalent(Expr a, Expr b) {
        return eq(a, b, new ArrayList<>(), new ArrayList<>());
    }

    private static boolean eq(Expr a, Expr b, List<String> boundA, List<String> boundB) {
        if (a == b && boundA.isEmpty()) return true;

        if (a instanceof Expr.MacroRef && b instanceof Expr.MacroRef
                && ((Expr.MacroRef) a).name.equals(((Expr.MacroRef) b).name)) {
            return true;
        }
        if (a instanceof Expr.MacroRef) return eq(((Expr.MacroRef) a).resolved, b, boundA, boundB);
        if (b instanceof Expr.MacroRef) return eq(a, ((Expr.MacroRef) b).resolved, boundA, boundB);

        if (a instanceof Expr.Var && b instanceof Expr.Var) {
            String na = ((Expr.Var) a).name;
            String nb = ((Expr.Var) b).name;
            int ia = boundA.lastIndexOf(na);
            int ib = boundB.lastIndexOf(nb);
            if (ia < 0 && ib < 0) return na.equals(nb);
            return ia == ib;
        }

        if (a instanceof Expr.Abs && b instanceof Expr.Abs) {
            Expr.Abs aa = (Expr.Abs) a;
            Expr.Abs ab = (Expr.Abs) b;
            boundA.add(aa.param);
            boundB.add(ab.param);
            try {
                return eq(aa.body, ab.body, boundA, boundB);
            } finally {
                boundA.remove(boundA.size() - 1);
                boundB.remove(boundB.size() - 1);
            }
        }

        if (a instanceof Expr.App && b instanceof Expr.App) {
            Expr.App pa = (Expr.App) a;
            Expr.App pb = (Expr.App) b;
            return eq(pa.fn, pb.fn, boundA, boundB) && eq(pa.arg, pb.arg, boundA, boundB);
        }

        return false;
    }
}
