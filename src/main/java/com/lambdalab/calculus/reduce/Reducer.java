package com.lambdalab.calculus.reduce;

import com.lambdalab.calculus.ast.Expr;

/** One-step reduction under a fixed strategy. */
public interface Reducer {

    /** Reduce one redex of {@code e}, or return null when {@code e} is a value or stuck. */
    Step step(Expr e);
}
