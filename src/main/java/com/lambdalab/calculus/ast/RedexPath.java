package com.lambdalab.calculus.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Location of a subterm as a sequence of moves from the root.
 * Immutable cons list; prepending shares the tail.
 */
public final class RedexPath {

    public enum Direction {
        /** Function side of an application. */
        FN,
        /** Argument side of an application. */
        ARG,
        /** Body of an abstraction. */
        BODY
    }

    public static final RedexPath ROOT = new RedexPath(null, null);

    private final Direction head;
    private final RedexPath tail;

    private RedexPath(Direction head, RedexPath tail) {
        this.head = head;
        this.tail = tail;
    }

    public static RedexPath of(Direction... moves) {
        RedexPath p = ROOT;
        for (int i = moves.length - 1; i >= 0; i--) p = p.prepend(moves[i]);
        return p;
    }

    public RedexPath prepend(Direction d) {
        return new RedexPath(d, this);
    }

    public boolean isRoot() { return head == null; }

    /** First move; null at the root. */
    public Direction head() { return head; }

    /** Path below the first move; null at the root. */
    public RedexPath tail() { return tail; }

    /** Follow the path; null if it leaves the tree. */
    public Expr select(Expr root) {
        Expr cur = root;
        RedexPath p = this;
        while (!p.isRoot()) {
            if (p.head == Direction.BODY && cur instanceof Expr.Abs) {
                cur = ((Expr.Abs) cur).body;
            } else if (p.head == Direction.FN && cur instanceof Expr.App) {
                cur = ((Expr.App) cur).fn;
            } else if (p.head == Direction.ARG && cur instanceof Expr.App) {
                cur = ((Expr.App) cur).arg;
            } else {
                return null;
            }
            p = p.tail;
        }
        return cur;
    }

    public List<Direction> moves() {
        List<Direction> out = new ArrayList<>();
        for (RedexPath p = this; !p.isRoot(); p = p.tail) out.add(p.head);
        return Collections.unmodifiableList(out);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RedexPath)) return false;
        return moves().equals(((RedexPath) o).moves());
    }

    @Override
    public int hashCode() {
        return moves().hashCode();
    }

    @Override
    public String toString() {
        return moves().toString();
    }
}
